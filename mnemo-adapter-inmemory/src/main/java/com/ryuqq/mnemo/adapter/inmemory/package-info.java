/**
 * In-memory StorageManager adapter package.
 *
 * <p>{@link com.ryuqq.mnemo.adapter.inmemory.RamStorage} keeps encoded copies of
 * units in process memory. It serves three roles:</p>
 * <ul>
 *   <li>a standalone store for tests and small applications</li>
 *   <li>the default cache backend of the mediator caches (bounded via
 *       {@link com.ryuqq.mnemo.adapter.inmemory.RamStorageConfig})</li>
 *   <li>the reference implementation the contract tests are calibrated on</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Transactions are whole-store snapshots, not isolated per caller</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.adapter.inmemory;
