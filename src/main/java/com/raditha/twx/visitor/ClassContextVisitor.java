package com.raditha.twx.visitor;

import com.raditha.twx.classify.ClassLikenessClassifier;
import com.raditha.twx.classify.ContextStack;
import com.raditha.twx.classify.TraversalContext;
import com.raditha.twx.classify.VariableAliasTable;
import com.raditha.twx.model.ExtractedToken;
import com.raditha.twx.parser.SyntaxTree;
import com.raditha.twx.parser.ast.ArrayLiteral;
import com.raditha.twx.parser.ast.AssignmentExpression;
import com.raditha.twx.parser.ast.BinaryExpression;
import com.raditha.twx.parser.ast.CallExpression;
import com.raditha.twx.parser.ast.ConditionalExpression;
import com.raditha.twx.parser.ast.GenericNode;
import com.raditha.twx.parser.ast.Identifier;
import com.raditha.twx.parser.ast.JsNode;
import com.raditha.twx.parser.ast.JsVisitorAdapter;
import com.raditha.twx.parser.ast.JsxAttribute;
import com.raditha.twx.parser.ast.JsxElement;
import com.raditha.twx.parser.ast.LogicalExpression;
import com.raditha.twx.parser.ast.MemberExpression;
import com.raditha.twx.parser.ast.MutableLiteral;
import com.raditha.twx.parser.ast.Property;
import com.raditha.twx.parser.ast.StringLiteral;
import com.raditha.twx.parser.ast.TemplateElement;
import com.raditha.twx.parser.ast.TemplateLiteral;
import com.raditha.twx.parser.ast.VariableDeclarator;
import com.raditha.twx.rewrite.TieredRewriter;
import com.raditha.twx.util.ClassTokens;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Walks one syntax tree, finds the string literals that hold class lists and
 * records (and in rewrite mode rewrites) the classes in them.
 * <p>
 * Where a string sits decides how it is treated: values of {@code className}
 * attributes and properties are always class lists; arguments of helper calls
 * such as {@code clsx} and strings bound to variables that feed class lists
 * go through the lenient classifier; any other string must look strongly like
 * utility classes. Functions, classes and JSX elements start a fresh context.
 * <p>
 * One visitor per tree; instances are not reusable.
 */
public class ClassContextVisitor extends JsVisitorAdapter {

    private static final Set<String> CLASS_NAMES = Set.of("className", "class");
    private static final Set<String> CLASS_LIST_METHODS = Set.of("add", "remove", "toggle", "replace");

    private final SyntaxTree tree;
    private final ClassLikenessClassifier classifier;
    private final VariableAliasTable aliases;
    private final TieredRewriter rewriter;
    private final boolean obfuscate;
    private final ContextStack stack = new ContextStack();
    private final List<ExtractedToken> tokens = new ArrayList<>();
    private int transformedCount;
    private int acceptedInClassContext;

    /**
     * @param rewriter {@code null} to only extract
     */
    public ClassContextVisitor(SyntaxTree tree, ClassLikenessClassifier classifier, VariableAliasTable aliases,
            TieredRewriter rewriter, boolean obfuscate) {
        this.tree = tree;
        this.classifier = classifier;
        this.aliases = aliases;
        this.rewriter = rewriter;
        this.obfuscate = obfuscate;
    }

    public void run() {
        tree.getRoot().accept(this);
    }

    public List<ExtractedToken> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public int getTransformedCount() {
        return transformedCount;
    }

    @Override
    public void visit(JsxElement n) {
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.General())) {
            visitChildren(n);
        }
    }

    @Override
    public void visit(JsxAttribute n) {
        if (!CLASS_NAMES.contains(n.getName()) || n.getValue() == null) {
            super.visit(n);
            return;
        }
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.JsxClassAttribute())) {
            visitClassValue(n.getValue());
        }
    }

    @Override
    public void visit(Property n) {
        String key = n.getKeyName();
        if (key != null && CLASS_NAMES.contains(key) && !n.isShorthand()) {
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.ClassNameProperty())) {
                visitClassValue(n.getValue());
            }
            return;
        }
        if (!n.isComputed() && !n.isShorthand() && n.getKey() instanceof StringLiteral literal) {
            // {'text-center font-bold': isActive}
            processIfClassLike(literal);
            n.getValue().accept(this);
            return;
        }
        super.visit(n);
    }

    @Override
    public void visit(AssignmentExpression n) {
        String target = n.getTargetName();
        if (target != null && CLASS_NAMES.contains(target)) {
            n.getTarget().accept(this);
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.ClassNameProperty())) {
                visitClassValue(n.getValue());
            }
            return;
        }
        if (n.getTarget() instanceof Identifier id && aliases.isClassBearing(id.getName())) {
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.TrackedVariable(id.getName()))) {
                n.getValue().accept(this);
            }
            return;
        }
        super.visit(n);
    }

    @Override
    public void visit(CallExpression n) {
        String name = n.getCalleeName();
        if (!aliases.isHelper(name) && !isClassListCall(n)) {
            super.visit(n);
            return;
        }
        n.getCallee().accept(this);
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.WhitelistedCall(name))) {
            for (JsNode argument : n.getArguments()) {
                argument.accept(this);
            }
        }
    }

    @Override
    public void visit(ConditionalExpression n) {
        if (!stack.inClassContext()) {
            super.visit(n);
            return;
        }
        visitAsCondition(n.getTest());
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.ConditionalBranch())) {
            n.getConsequent().accept(this);
            n.getAlternate().accept(this);
        }
    }

    @Override
    public void visit(LogicalExpression n) {
        if (!stack.inClassContext()) {
            super.visit(n);
            return;
        }
        if (n.getOperator().equals("&&")) {
            visitAsCondition(n.getLeft());
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.ConditionalBranch())) {
                n.getRight().accept(this);
            }
            return;
        }
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.ConditionalBranch())) {
            n.getLeft().accept(this);
            n.getRight().accept(this);
        }
    }

    @Override
    public void visit(BinaryExpression n) {
        if (!n.getOperator().equals("+")) {
            // comparisons and arithmetic never produce class lists
            visitAsCondition(n);
            return;
        }
        String tracked = trackedName(n.getLeft(), n.getRight());
        if (tracked == null) {
            super.visit(n);
            return;
        }
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.TrackedVariable(tracked))) {
            visitChildren(n);
        }
    }

    @Override
    public void visit(ArrayLiteral n) {
        String tracked = trackedName(n.getElements().toArray(new JsNode[0]));
        if (tracked == null) {
            super.visit(n);
            return;
        }
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.TrackedVariable(tracked))) {
            visitChildren(n);
        }
    }

    @Override
    public void visit(VariableDeclarator n) {
        n.getTarget().accept(this);
        JsNode init = n.getInit();
        if (init == null) {
            return;
        }
        String name = n.getName();
        int pushesBefore = stack.classBearingPushes();
        int acceptedBefore = acceptedInClassContext;
        if (name != null && VariableAliasTable.isClassishName(name)) {
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.TrackedVariable(name))) {
                pushesBefore = stack.classBearingPushes();
                init.accept(this);
            }
        } else {
            init.accept(this);
        }
        if (name != null && (stack.classBearingPushes() > pushesBefore || acceptedInClassContext > acceptedBefore)) {
            aliases.mark(name);
        }
    }

    @Override
    public void visit(GenericNode n) {
        if (n.isScope()) {
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.General())) {
                visitChildren(n);
            }
            return;
        }
        if (n.getKind() == GenericNode.Kind.TAGGED_TEMPLATE && n.getChildren().size() == 2) {
            JsNode tag = n.getChildren().get(0);
            String tagName = tag instanceof Identifier id ? id.getName()
                    : tag instanceof MemberExpression member ? member.getPropertyName() : null;
            if (aliases.isHelper(tagName)) {
                tag.accept(this);
                try (ContextStack.Scope scope = stack.enter(new TraversalContext.WhitelistedCall(tagName))) {
                    n.getChildren().get(1).accept(this);
                }
                return;
            }
        }
        super.visit(n);
    }

    @Override
    public void visit(StringLiteral n) {
        processIfClassLike(n);
    }

    @Override
    public void visit(TemplateLiteral n) {
        String tracked = trackedName(n.getExpressions().toArray(new JsNode[0]));
        if (tracked != null) {
            try (ContextStack.Scope scope = stack.enter(new TraversalContext.TrackedVariable(tracked))) {
                visitTemplate(n);
            }
        } else {
            visitTemplate(n);
        }
    }

    private void visitTemplate(TemplateLiteral n) {
        List<TemplateElement> quasis = n.getQuasis();
        for (int i = 0; i < quasis.size(); i++) {
            processQuasi(quasis.get(i), i > 0, i < quasis.size() - 1);
        }
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.TemplateLiteral())) {
            for (JsNode expression : n.getExpressions()) {
                expression.accept(this);
            }
        }
    }

    /**
     * A value in class position: a string is a class list no matter what it
     * looks like; anything else is visited under the current context.
     */
    private void visitClassValue(JsNode value) {
        if (value instanceof StringLiteral literal) {
            process(literal, literal.getValue(), 0, literal.getValue().length());
        } else if (value != null) {
            value.accept(this);
        }
    }

    /**
     * Visit a subtree whose strings are tests rather than class values.
     */
    private void visitAsCondition(JsNode node) {
        try (ContextStack.Scope scope = stack.enter(new TraversalContext.General())) {
            if (node instanceof BinaryExpression binary) {
                visitChildren(binary);
            } else {
                node.accept(this);
            }
        }
    }

    private void processIfClassLike(StringLiteral literal) {
        String value = literal.getValue();
        if (classifier.isClassLike(value, stack)) {
            process(literal, value, 0, value.length());
        }
    }

    /**
     * Template segments next to an interpolation may end in half a class
     * ({@code bg-${color}-500}); those fragments are neither recorded nor
     * rewritten.
     */
    private void processQuasi(TemplateElement quasi, boolean afterExpression, boolean beforeExpression) {
        String value = quasi.getValue();
        if (value.isEmpty()) {
            return;
        }
        List<ClassTokens.Span> spans = ClassTokens.spans(value);
        if (spans.isEmpty()) {
            return;
        }
        int coreStart = 0;
        int coreEnd = value.length();
        if (afterExpression && !ClassTokens.isWhitespace(value.charAt(0))) {
            coreStart = spans.get(0).end();
        }
        if (beforeExpression && !ClassTokens.isWhitespace(value.charAt(value.length() - 1))) {
            coreEnd = spans.get(spans.size() - 1).start();
        }
        if (coreStart >= coreEnd) {
            return;
        }
        String core = value.substring(coreStart, coreEnd);
        if (ClassTokens.isBlank(core) || !classifier.isClassLike(core.strip(), stack)) {
            return;
        }
        process(quasi, value, coreStart, coreEnd);
    }

    /**
     * Record the classes in {@code value[from, to)} and, in rewrite mode,
     * replace that range with its rewritten form.
     */
    private void process(MutableLiteral literal, String value, int from, int to) {
        String segment = value.substring(from, to);
        if (ClassTokens.isBlank(segment)) {
            return;
        }
        if (stack.inClassContext()) {
            acceptedInClassContext++;
        }
        for (ClassTokens.Span span : ClassTokens.spans(segment)) {
            String token = segment.substring(span.start(), span.end());
            if (!ClassTokens.isRecordable(token)) {
                continue;
            }
            int offset = literal.sourceOffset(from + span.start());
            tokens.add(new ExtractedToken(token, tree.getUnit().identity(), tree.line(offset), tree.column(offset)));
        }
        if (rewriter == null) {
            return;
        }
        String rewritten = rewriter.rewrite(segment, obfuscate);
        if (!rewritten.equals(segment)) {
            literal.setValue(value.substring(0, from) + rewritten + value.substring(to));
            transformedCount++;
        }
    }

    private String trackedName(JsNode... operands) {
        for (JsNode operand : operands) {
            if (operand instanceof Identifier id && aliases.isClassBearing(id.getName())) {
                return id.getName();
            }
        }
        return null;
    }

    private static boolean isClassListCall(CallExpression call) {
        return call.getCallee() instanceof MemberExpression method
                && CLASS_LIST_METHODS.contains(method.getPropertyName())
                && method.getObject() instanceof MemberExpression owner
                && "classList".equals(owner.getPropertyName());
    }
}
