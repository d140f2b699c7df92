/**
 * Merge-window coalescing of same-sender bursts, applied at write time and again at read time.
 */
package chatlog.merge;
