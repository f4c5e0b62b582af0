/**
 * Domain model for the application lifecycle.
 *
 * <p>Identifiers ({@link com.ryuqq.autoapply.core.model.ApplicationId},
 * {@link com.ryuqq.autoapply.core.model.JobId}, ...) are immutable value objects.
 * {@link com.ryuqq.autoapply.core.model.Job}, {@link com.ryuqq.autoapply.core.model.Resume}
 * and {@link com.ryuqq.autoapply.core.model.Application} are records; changes produce new instances.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.model;
