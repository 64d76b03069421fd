package com.raditha.twx.classify;

/**
 * Syntactic situation the visitor is currently in. Frames are pushed on a
 * {@link ContextStack} while a subtree is visited.
 */
public sealed interface TraversalContext {

    enum Kind {
        GENERAL,
        JSX_CLASS_ATTRIBUTE,
        CLASS_NAME_PROPERTY,
        WHITELISTED_CALL,
        CONDITIONAL_BRANCH,
        TEMPLATE_LITERAL,
        TRACKED_VARIABLE
    }

    Kind kind();

    /**
     * Whether strings directly under this frame are class lists, independent
     * of what lies below it on the stack. {@link ConditionalBranch} and
     * {@link TemplateLiteral} inherit from the frames beneath them instead.
     */
    default boolean classBearing() {
        return switch (kind()) {
            case JSX_CLASS_ATTRIBUTE, CLASS_NAME_PROPERTY, WHITELISTED_CALL, TRACKED_VARIABLE -> true;
            case GENERAL, CONDITIONAL_BRANCH, TEMPLATE_LITERAL -> false;
        };
    }

    /**
     * Ordinary code; also the scope boundary for functions, classes and JSX
     * elements.
     */
    record General() implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.GENERAL;
        }
    }

    record JsxClassAttribute() implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.JSX_CLASS_ATTRIBUTE;
        }
    }

    record ClassNameProperty() implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.CLASS_NAME_PROPERTY;
        }
    }

    record WhitelistedCall(String name) implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.WHITELISTED_CALL;
        }
    }

    record ConditionalBranch() implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.CONDITIONAL_BRANCH;
        }
    }

    record TemplateLiteral() implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.TEMPLATE_LITERAL;
        }
    }

    record TrackedVariable(String name) implements TraversalContext {
        @Override
        public Kind kind() {
            return Kind.TRACKED_VARIABLE;
        }
    }
}
