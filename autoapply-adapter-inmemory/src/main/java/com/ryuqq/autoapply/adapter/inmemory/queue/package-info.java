/**
 * In-memory delayed work queue backed by {@link java.util.concurrent.DelayQueue}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.adapter.inmemory.queue;
