/**
 * Control surface of the orchestrator: submit, status, approve, reject, cancel and event stream.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.application.orchestrator;
