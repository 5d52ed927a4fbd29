/**
 * In-memory Directory Store adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.orgmigration.core.spi.DirectoryStore} SPI used by unit, scenario and
 * contract tests.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Concurrency:</strong> every public method is {@code synchronized}, so each SPI call
 *       behaves like one committed statement</li>
 *   <li><strong>Constraints:</strong> the same uniqueness keys a relational store would declare</li>
 *   <li><strong>No transactions:</strong> nothing spans two calls, matching the engine's commit model</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.orgmigration.core.spi.DirectoryStore
 * @author OrgMigration Team
 * @since 1.0.0
 */
package com.ryuqq.orgmigration.adapter.inmemory.store;
