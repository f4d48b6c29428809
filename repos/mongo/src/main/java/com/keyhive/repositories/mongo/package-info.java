/**
 * MongoDB backend for the key store.
 * <p>
 * Each key is one document in a single collection ({@code hkp.keys} by default) with
 * unique indexes on the reversed fingerprint and on the MD5 digest, and plain indexes
 * on the modification time and the keyword array. Updates are optimistic: the caller
 * presents the digest it last saw and the write only happens if the document still
 * carries it.
 */
package com.keyhive.repositories.mongo;
