/**
 * Application lifecycle state machine.
 *
 * <p>{@link com.ryuqq.autoapply.core.statemachine.StateTransition} is total over
 * (state, trigger): every pair either yields a next state or raises
 * {@link com.ryuqq.autoapply.core.statemachine.IllegalTransitionException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.autoapply.core.statemachine;
