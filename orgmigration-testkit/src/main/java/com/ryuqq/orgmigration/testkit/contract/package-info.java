/**
 * Contract tests and fixtures for {@link com.ryuqq.orgmigration.core.spi.DirectoryStore} adapters.
 *
 * <p>Adapters extend {@link com.ryuqq.orgmigration.testkit.contract.AbstractDirectoryStoreContractTest}
 * in their own test sources; scenario tests build records with
 * {@link com.ryuqq.orgmigration.testkit.contract.DirectoryFixtures}.</p>
 *
 * @author OrgMigration Team
 * @since 1.0.0
 */
package com.ryuqq.orgmigration.testkit.contract;
