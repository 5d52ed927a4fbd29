/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Defines the {@link com.ryuqq.orgmigration.core.spi.DirectoryStore} contract that
 * infrastructure adapters implement, together with the patch types it accepts.</p>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., orgmigration-adapter-inmemory) provide concrete implementations.
 * Every adapter is expected to pass {@code AbstractDirectoryStoreContractTest} from
 * orgmigration-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Explicit Injection:</strong> The engine receives the store through its constructor, never through a global handle</li>
 *   <li><strong>Constraint-based Exclusion:</strong> Uniqueness violations surface as {@link com.ryuqq.orgmigration.core.spi.UniqueConstraintViolationException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author OrgMigration Team
 */
package com.ryuqq.orgmigration.core.spi;
