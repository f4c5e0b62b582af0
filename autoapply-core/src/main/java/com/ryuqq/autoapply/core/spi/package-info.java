/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to provide concrete persistence for the orchestration core.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.autoapply.core.spi.ApplicationStore} - application projections with compare-and-set</li>
 *   <li>{@link com.ryuqq.autoapply.core.spi.JobStore} - jobs, deduplicated by source URL</li>
 *   <li>{@link com.ryuqq.autoapply.core.spi.ResumeStore} - immutable resume versions</li>
 *   <li>{@link com.ryuqq.autoapply.core.spi.EventLog} - append-only lifecycle events</li>
 *   <li>{@link com.ryuqq.autoapply.core.spi.WorkQueue} - delayed dispatch queue</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> InMemory for tests, a database adapter for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.autoapply.core.spi;
