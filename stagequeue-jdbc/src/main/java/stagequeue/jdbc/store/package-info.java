/**
 * Portable SQL implementations of the persistence SPIs, tested on H2 in MySQL mode.
 */
package stagequeue.jdbc.store;
