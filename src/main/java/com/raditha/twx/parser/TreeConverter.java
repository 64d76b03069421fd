package com.raditha.twx.parser;

import com.raditha.twx.exceptions.ParseException;
import com.raditha.twx.model.SourceUnit;
import com.raditha.twx.parser.ast.ArrayLiteral;
import com.raditha.twx.parser.ast.AssignmentExpression;
import com.raditha.twx.parser.ast.BinaryExpression;
import com.raditha.twx.parser.ast.CallExpression;
import com.raditha.twx.parser.ast.ConditionalExpression;
import com.raditha.twx.parser.ast.GenericNode;
import com.raditha.twx.parser.ast.GenericNode.Kind;
import com.raditha.twx.parser.ast.Identifier;
import com.raditha.twx.parser.ast.JsNode;
import com.raditha.twx.parser.ast.JsxAttribute;
import com.raditha.twx.parser.ast.JsxElement;
import com.raditha.twx.parser.ast.JsxExpressionContainer;
import com.raditha.twx.parser.ast.JsxText;
import com.raditha.twx.parser.ast.LogicalExpression;
import com.raditha.twx.parser.ast.MemberExpression;
import com.raditha.twx.parser.ast.MutableLiteral;
import com.raditha.twx.parser.ast.ObjectLiteral;
import com.raditha.twx.parser.ast.Program;
import com.raditha.twx.parser.ast.Property;
import com.raditha.twx.parser.ast.StringLiteral;
import com.raditha.twx.parser.ast.TemplateElement;
import com.raditha.twx.parser.ast.TemplateLiteral;
import com.raditha.twx.parser.ast.VariableDeclarator;

import org.jspecify.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts a tree-sitter concrete syntax tree into the expression model the
 * extractor walks. Type-level TypeScript syntax, comments and import
 * declarations produce no nodes. Every string and template segment that
 * survives is registered as a {@link MutableLiteral}, in source order.
 * <p>
 * One converter per tree.
 */
final class TreeConverter {

    private static final Set<String> SKIPPED = Set.of(
            "comment", "hash_bang_line", "html_comment", "import_statement", "export_clause",
            "type_annotation", "type_predicate_annotation", "asserts_annotation", "opting_type_annotation",
            "omitting_type_annotation", "adding_type_annotation", "type_arguments", "type_parameters",
            "type_alias_declaration", "interface_declaration", "implements_clause", "ambient_declaration",
            "index_signature", "abstract_method_signature", "method_signature", "property_signature",
            "call_signature", "construct_signature", "function_signature", "accessibility_modifier",
            "override_modifier", "type_identifier", "nested_type_identifier", "import_alias");

    private static final Set<String> IDENTIFIERS = Set.of(
            "identifier", "property_identifier", "shorthand_property_identifier",
            "shorthand_property_identifier_pattern", "private_property_identifier", "statement_identifier",
            "this", "super");

    private static final Set<String> FUNCTIONS = Set.of(
            "function_declaration", "function_expression", "function", "generator_function_declaration",
            "generator_function", "arrow_function", "method_definition");

    private static final Set<String> CLASSES = Set.of("class_declaration", "class", "abstract_class_declaration");

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||", "??");

    private static final Set<String> NAME_FIELD = Set.of("name");

    private final SourceUnit unit;
    private final String src;
    private final ByteOffsets offsets;
    private final LineMap lines;
    private final List<MutableLiteral> literals = new ArrayList<>();

    TreeConverter(SourceUnit unit, ByteOffsets offsets, LineMap lines) {
        this.unit = unit;
        this.src = unit.content();
        this.offsets = offsets;
        this.lines = lines;
    }

    SyntaxTree convert(TSNode root) throws ParseException {
        Program program = new Program(0, src.length(), children(root, Set.of()));
        return new SyntaxTree(unit, program, literals, lines);
    }

    private @Nullable JsNode node(TSNode n) throws ParseException {
        String type = n.getType();
        if (isSkipped(type)) {
            return null;
        }
        if (IDENTIFIERS.contains(type)) {
            return new Identifier(start(n), end(n), text(n));
        }
        return switch (type) {
            case "string" -> string(n, false);
            case "template_string" -> template(n);
            case "member_expression" -> new MemberExpression(start(n), end(n), required(n, "object"),
                    text(field(n, "property")), null);
            case "subscript_expression" -> new MemberExpression(start(n), end(n), required(n, "object"), null,
                    required(n, "index"));
            case "call_expression" -> call(n);
            case "new_expression" -> construct(n);
            case "ternary_expression" -> new ConditionalExpression(start(n), end(n), required(n, "condition"),
                    required(n, "consequence"), required(n, "alternative"));
            case "binary_expression" -> binary(n);
            case "assignment_expression" -> new AssignmentExpression(start(n), end(n), "=", required(n, "left"),
                    required(n, "right"));
            case "augmented_assignment_expression" -> new AssignmentExpression(start(n), end(n),
                    operator(n), required(n, "left"), required(n, "right"));
            case "assignment_pattern" -> new AssignmentExpression(start(n), end(n), "=", required(n, "left"),
                    required(n, "right"));
            case "parenthesized_expression", "non_null_expression", "as_expression", "satisfies_expression",
                    "instantiation_expression" -> unwrap(n, firstNamed(n));
            case "type_assertion" -> unwrap(n, lastNamed(n));
            case "variable_declarator" -> new VariableDeclarator(start(n), end(n), required(n, "name"),
                    optional(field(n, "value")));
            case "required_parameter", "optional_parameter" -> parameter(n);
            case "object", "object_pattern" -> object(n);
            case "array", "array_pattern" -> new ArrayLiteral(start(n), end(n), children(n, Set.of()));
            case "class_body" -> classBody(n);
            case "enum_declaration" -> enumeration(n);
            case "export_statement" -> new GenericNode(start(n), end(n), Kind.DECLARATION,
                    children(n, Set.of("source")));
            case "jsx_element" -> jsxElement(n);
            case "jsx_self_closing_element" -> new JsxElement(start(n), end(n), tagName(n), jsxAttributes(n),
                    List.of(), true);
            case "jsx_expression" -> new JsxExpressionContainer(start(n), end(n), optional(firstNamed(n)));
            case "jsx_text" -> new JsxText(start(n), end(n), text(n));
            default -> {
                Kind kind = kindOf(type);
                Set<String> excluded = kind == Kind.FUNCTION || kind == Kind.CLASS ? NAME_FIELD : Set.of();
                yield new GenericNode(start(n), end(n), kind, children(n, excluded));
            }
        };
    }

    private static boolean isSkipped(String type) {
        return SKIPPED.contains(type) || type.endsWith("_type");
    }

    private static Kind kindOf(String type) {
        if (FUNCTIONS.contains(type)) {
            return Kind.FUNCTION;
        }
        if (CLASSES.contains(type)) {
            return Kind.CLASS;
        }
        return switch (type) {
            case "statement_block", "switch_body", "class_static_block" -> Kind.BLOCK;
            case "lexical_declaration", "variable_declaration" -> Kind.DECLARATION;
            case "formal_parameters" -> Kind.PARAMETERS;
            case "unary_expression", "update_expression", "await_expression", "yield_expression" -> Kind.UNARY;
            case "sequence_expression" -> Kind.SEQUENCE;
            case "spread_element", "rest_pattern" -> Kind.SPREAD;
            case "decorator" -> Kind.DECORATOR;
            case "number", "true", "false", "null", "undefined", "regex" -> Kind.LITERAL;
            default -> type.endsWith("_statement") || type.endsWith("_clause") || type.startsWith("switch_")
                    ? Kind.STATEMENT : Kind.OTHER;
        };
    }

    // Literals

    private StringLiteral string(TSNode n, boolean jsxAttribute) {
        int start = start(n);
        int end = end(n);
        char quote = src.charAt(start);
        StringLiteral literal;
        if (jsxAttribute) {
            literal = new StringLiteral(start, end, src.substring(start + 1, end - 1), quote, true, null);
        } else {
            LiteralCooker.Cooked cooked = LiteralCooker.cook(src, start + 1, end - 1);
            literal = new StringLiteral(start, end, cooked.value(), quote, false, cooked.offsets());
        }
        literals.add(literal);
        return literal;
    }

    /**
     * Quasis are the gaps between substitutions, so the segment text does not
     * depend on how the grammar splits template characters into nodes.
     */
    private TemplateLiteral template(TSNode n) throws ParseException {
        List<TemplateElement> quasis = new ArrayList<>();
        List<JsNode> expressions = new ArrayList<>();
        int contentStart = start(n) + 1;
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            if (!"template_substitution".equals(child.getType())) {
                continue;
            }
            quasis.add(quasi(contentStart, start(child), false));
            expressions.add(unwrap(child, firstNamed(child)));
            contentStart = end(child);
        }
        quasis.add(quasi(contentStart, end(n) - 1, true));
        return new TemplateLiteral(start(n), end(n), quasis, expressions);
    }

    private TemplateElement quasi(int from, int to, boolean tail) {
        LiteralCooker.Cooked cooked = LiteralCooker.cook(src, from, to);
        TemplateElement element = new TemplateElement(from, to, cooked.value(), cooked.offsets(), tail);
        literals.add(element);
        return element;
    }

    // Expressions

    private JsNode call(TSNode n) throws ParseException {
        JsNode callee = required(n, "function");
        TSNode arguments = field(n, "arguments");
        if (arguments != null && "template_string".equals(arguments.getType())) {
            return new GenericNode(start(n), end(n), Kind.TAGGED_TEMPLATE, List.of(callee, template(arguments)));
        }
        List<JsNode> args = arguments == null ? List.of() : children(arguments, Set.of());
        return new CallExpression(start(n), end(n), callee, args, false);
    }

    private JsNode construct(TSNode n) throws ParseException {
        JsNode callee = required(n, "constructor");
        TSNode arguments = field(n, "arguments");
        List<JsNode> args = arguments == null ? List.of() : children(arguments, Set.of());
        return new CallExpression(start(n), end(n), callee, args, true);
    }

    private JsNode binary(TSNode n) throws ParseException {
        String operator = operator(n);
        JsNode left = required(n, "left");
        JsNode right = required(n, "right");
        if (LOGICAL_OPERATORS.contains(operator)) {
            return new LogicalExpression(start(n), end(n), operator, left, right);
        }
        return new BinaryExpression(start(n), end(n), operator, left, right);
    }

    private JsNode parameter(TSNode n) throws ParseException {
        JsNode pattern = required(n, "pattern");
        JsNode value = optional(field(n, "value"));
        if (value == null) {
            return pattern;
        }
        return new AssignmentExpression(start(n), end(n), "=", pattern, value);
    }

    private ObjectLiteral object(TSNode n) throws ParseException {
        List<JsNode> members = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode member = n.getNamedChild(i);
            JsNode converted = switch (member.getType()) {
                case "pair", "pair_pattern" -> property(member, "key", "value");
                case "shorthand_property_identifier", "shorthand_property_identifier_pattern" -> {
                    Identifier id = new Identifier(start(member), end(member), text(member));
                    yield new Property(id.getStart(), id.getEnd(), id, id, false, true);
                }
                case "object_assignment_pattern" -> {
                    JsNode key = required(member, "left");
                    JsNode value = new AssignmentExpression(start(member), end(member), "=", key,
                            required(member, "right"));
                    yield new Property(start(member), end(member), key, value, false, true);
                }
                case "method_definition" -> method(member);
                default -> node(member);
            };
            if (converted != null) {
                members.add(converted);
            }
        }
        return new ObjectLiteral(start(n), end(n), members);
    }

    private @Nullable Property property(TSNode n, String keyField, String valueField) throws ParseException {
        TSNode keyNode = field(n, keyField);
        TSNode valueNode = field(n, valueField);
        if (keyNode == null || valueNode == null) {
            return null;
        }
        boolean computed = "computed_property_name".equals(keyNode.getType());
        JsNode key = computed ? unwrap(keyNode, firstNamed(keyNode)) : unwrap(keyNode, keyNode);
        JsNode value = unwrap(valueNode, valueNode);
        return new Property(start(n), end(n), key, value, computed, false);
    }

    private Property method(TSNode n) throws ParseException {
        TSNode nameNode = field(n, "name");
        boolean computed = nameNode != null && "computed_property_name".equals(nameNode.getType());
        JsNode key = nameNode == null ? GenericNode.leaf(start(n), start(n), Kind.OTHER)
                : computed ? unwrap(nameNode, firstNamed(nameNode)) : unwrap(nameNode, nameNode);
        GenericNode function = new GenericNode(start(n), end(n), Kind.FUNCTION, children(n, NAME_FIELD));
        return new Property(start(n), end(n), key, function, computed, false);
    }

    private GenericNode classBody(TSNode n) throws ParseException {
        List<JsNode> members = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode member = n.getNamedChild(i);
            JsNode converted = switch (member.getType()) {
                case "method_definition" -> method(member);
                case "field_definition" -> property(member, "property", "value");
                case "public_field_definition" -> property(member, "name", "value");
                default -> node(member);
            };
            if (converted != null) {
                members.add(converted);
            }
        }
        return new GenericNode(start(n), end(n), Kind.BLOCK, members);
    }

    /**
     * Only member initializers carry values; the member names do not.
     */
    private GenericNode enumeration(TSNode n) throws ParseException {
        List<JsNode> initializers = new ArrayList<>();
        TSNode body = field(n, "body");
        if (body != null) {
            for (int i = 0; i < body.getNamedChildCount(); i++) {
                TSNode member = body.getNamedChild(i);
                if ("enum_assignment".equals(member.getType())) {
                    JsNode value = optional(field(member, "value"));
                    if (value != null) {
                        initializers.add(value);
                    }
                }
            }
        }
        return new GenericNode(start(n), end(n), Kind.ENUM, initializers);
    }

    // JSX

    private JsxElement jsxElement(TSNode n) throws ParseException {
        TSNode open = null;
        TSNode close = null;
        List<JsNode> children = new ArrayList<>();
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            switch (child.getType()) {
                case "jsx_opening_element" -> open = child;
                case "jsx_closing_element" -> close = child;
                default -> {
                    JsNode converted = node(child);
                    if (converted != null) {
                        children.add(converted);
                    }
                }
            }
        }
        String name = open == null ? "" : tagName(open);
        String closing = close == null ? "" : tagName(close);
        if (!name.equals(closing)) {
            int at = close == null ? end(n) : start(close);
            throw new ParseException(unit.identity(), lines.line(at), lines.column(at),
                    "Expected closing tag for <" + name + "> but found </" + closing + ">");
        }
        List<JsNode> attributes = open == null ? List.of() : jsxAttributes(open);
        return new JsxElement(start(n), end(n), name, attributes, children, false);
    }

    private String tagName(TSNode tag) {
        TSNode name = field(tag, "name");
        return name == null ? "" : text(name);
    }

    private List<JsNode> jsxAttributes(TSNode tag) throws ParseException {
        List<JsNode> attributes = new ArrayList<>();
        for (int i = 0; i < tag.getNamedChildCount(); i++) {
            TSNode child = tag.getNamedChild(i);
            if ("jsx_attribute".equals(child.getType())) {
                attributes.add(jsxAttribute(child));
            } else if ("jsx_expression".equals(child.getType())) {
                attributes.add(node(child));
            }
        }
        return attributes;
    }

    private JsxAttribute jsxAttribute(TSNode n) throws ParseException {
        String name = n.getNamedChildCount() > 0 ? text(n.getNamedChild(0)) : "";
        JsNode value = null;
        if (n.getNamedChildCount() > 1) {
            TSNode valueNode = n.getNamedChild(1);
            value = "string".equals(valueNode.getType()) ? string(valueNode, true) : node(valueNode);
        }
        return new JsxAttribute(start(n), end(n), name, value);
    }

    // Tree-sitter helpers

    /**
     * Named children converted in order, leaving out the listed fields.
     */
    private List<JsNode> children(TSNode n, Set<String> excludedFields) throws ParseException {
        List<JsNode> out = new ArrayList<>();
        for (int i = 0; i < n.getChildCount(); i++) {
            TSNode child = n.getChild(i);
            if (!child.isNamed()) {
                continue;
            }
            String fieldName = n.getFieldNameForChild(i);
            if (fieldName != null && excludedFields.contains(fieldName)) {
                continue;
            }
            JsNode converted = node(child);
            if (converted != null) {
                out.add(converted);
            }
        }
        return out;
    }

    private JsNode required(TSNode parent, String fieldName) throws ParseException {
        TSNode child = field(parent, fieldName);
        return child == null ? GenericNode.leaf(end(parent), end(parent), Kind.OTHER) : unwrap(child, child);
    }

    private @Nullable JsNode optional(@Nullable TSNode n) throws ParseException {
        return n == null ? null : node(n);
    }

    /**
     * Convert {@code inner}, standing in an empty leaf spanning {@code outer}
     * when it yields nothing.
     */
    private JsNode unwrap(TSNode outer, @Nullable TSNode inner) throws ParseException {
        JsNode converted = inner == null ? null : node(inner);
        return converted != null ? converted : GenericNode.leaf(start(outer), end(outer), Kind.OTHER);
    }

    private static @Nullable TSNode field(TSNode n, String name) {
        TSNode child = n.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    private static @Nullable TSNode firstNamed(TSNode n) {
        for (int i = 0; i < n.getNamedChildCount(); i++) {
            TSNode child = n.getNamedChild(i);
            if (!isSkipped(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static @Nullable TSNode lastNamed(TSNode n) {
        for (int i = n.getNamedChildCount() - 1; i >= 0; i--) {
            TSNode child = n.getNamedChild(i);
            if (!isSkipped(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private String operator(TSNode n) {
        String operator = text(field(n, "operator"));
        return operator == null ? "" : operator;
    }

    private int start(TSNode n) {
        return offsets.toChar(n.getStartByte());
    }

    private int end(TSNode n) {
        return offsets.toChar(n.getEndByte());
    }

    private @Nullable String text(@Nullable TSNode n) {
        return n == null ? null : src.substring(start(n), end(n));
    }
}
