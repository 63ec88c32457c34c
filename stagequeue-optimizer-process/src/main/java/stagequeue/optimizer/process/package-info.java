/**
 * Out-of-process optimizers: scripts that read a JSON request on stdin and print a JSON
 * result on stdout.
 */
package stagequeue.optimizer.process;
