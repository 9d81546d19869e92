/**
 * Core contracts of the journal: content hashes, events, refs and the event store.
 *
 * <p>Every aggregate is a hash chain. Each event names the hash of its predecessor and the
 * aggregate's ref names the hash of its newest event. Committing compares the caller's
 * expected version with the ref and moves both forward atomically.
 */
package dev.mars.journal.api;
