package com.raditha.twx.classify;

import java.util.ArrayList;
import java.util.List;

/**
 * Stack of {@link TraversalContext} frames with {@link TraversalContext.General}
 * permanently at the base. Frames are pushed through {@link #enter} so every
 * push is matched by a pop even when visiting throws.
 */
public class ContextStack {

    private static final TraversalContext.General BASE = new TraversalContext.General();

    private final List<TraversalContext> frames = new ArrayList<>();
    private int classBearingPushes;

    public ContextStack() {
        frames.add(BASE);
    }

    /**
     * Scope returned by {@link #enter}; closing it pops the frame.
     */
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    public Scope enter(TraversalContext context) {
        push(context);
        int depth = frames.size();
        return () -> pop(depth);
    }

    public void push(TraversalContext context) {
        frames.add(context);
        if (context.classBearing()) {
            classBearingPushes++;
        }
    }

    private void pop(int expectedDepth) {
        assert frames.size() == expectedDepth : "unbalanced context stack";
        if (frames.size() <= 1) {
            throw new IllegalStateException("cannot pop the base context");
        }
        frames.remove(frames.size() - 1);
    }

    public void pop() {
        pop(frames.size());
    }

    public TraversalContext top() {
        return frames.get(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    /**
     * True when the nearest frame that decides class-bearing status does so.
     * {@link TraversalContext.ConditionalBranch} and
     * {@link TraversalContext.TemplateLiteral} defer to the frames below;
     * a {@link TraversalContext.General} frame ends the search.
     */
    public boolean inClassContext() {
        for (int i = frames.size() - 1; i >= 0; i--) {
            Boolean decided = switch (frames.get(i).kind()) {
                case JSX_CLASS_ATTRIBUTE, CLASS_NAME_PROPERTY, WHITELISTED_CALL, TRACKED_VARIABLE -> Boolean.TRUE;
                case GENERAL -> Boolean.FALSE;
                case CONDITIONAL_BRANCH, TEMPLATE_LITERAL -> null;
            };
            if (decided != null) {
                return decided;
            }
        }
        return false;
    }

    /**
     * Number of class-bearing frames pushed so far. Used to tell whether a
     * subtree contained one.
     */
    public int classBearingPushes() {
        return classBearingPushes;
    }
}
