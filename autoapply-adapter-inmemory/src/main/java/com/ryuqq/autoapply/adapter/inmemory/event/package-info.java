/**
 * In-memory lifecycle event log with push subscriptions.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.inmemory.event;
