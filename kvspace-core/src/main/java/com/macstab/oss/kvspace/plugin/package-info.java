/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Plugin SPI and pipeline.
 *
 * <p>Implement {@link com.macstab.oss.kvspace.plugin.KvSpacePlugin} and register it with {@code
 * KvSpace.use(...)}. Plugins transform values and keys around the store operations (envelopes,
 * encryption, compression, quotas) and observe completed operations. {@link
 * com.macstab.oss.kvspace.plugin.ttl.TtlPlugin} is the built-in example.
 */
package com.macstab.oss.kvspace.plugin;
