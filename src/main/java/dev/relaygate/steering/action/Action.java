package dev.relaygate.steering.action;

import dev.relaygate.steering.EvaluationContext;

import java.util.Map;

/**
 * A steering action. The set of kinds is closed: each permitted record carries
 * its own typed parameters and its own effect on the context, so adding a kind
 * means adding a record here and the compiler points at everything else.
 *
 * <p>{@link UnsupportedAction} keeps rule files forward-compatible with kinds
 * added by newer releases; it is a logged no-op.
 */
public sealed interface Action
        permits RouteAction, RejectAction, TransformAction, InjectAction, LogAction, UnsupportedAction {

    /** Wire name of the kind, as written in rule files. */
    String typeName();

    /**
     * Applies this action to the context.
     *
     * @return true if the context changed (or, for log actions, a line was emitted)
     */
    boolean applyTo(EvaluationContext context);

    /** Parameters in their wire form, for persistence and admin responses. */
    Map<String, Object> params();
}
