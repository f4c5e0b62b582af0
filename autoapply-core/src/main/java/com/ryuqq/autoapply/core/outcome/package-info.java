/**
 * Stage invocation outcomes and the failure taxonomy.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.outcome;
