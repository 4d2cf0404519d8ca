/**
 * SQLite persistence. All methods throw {@link io.serverpulse.storage.StorageException} on
 * driver errors.
 */
package io.serverpulse.storage;
