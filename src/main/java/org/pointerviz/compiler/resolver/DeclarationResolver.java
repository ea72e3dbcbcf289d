package org.pointerviz.compiler.resolver;

import org.pointerviz.compiler.diagnostics.DiagnosticsEngine;
import org.pointerviz.compiler.frontend.lexer.Lexer;
import org.pointerviz.compiler.frontend.lexer.Token;
import org.pointerviz.compiler.frontend.parser.Parser;
import org.pointerviz.compiler.frontend.parser.ast.AddressOfExpression;
import org.pointerviz.compiler.frontend.parser.ast.DeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.DereferenceExpression;
import org.pointerviz.compiler.frontend.parser.ast.ExpressionNode;
import org.pointerviz.compiler.frontend.parser.ast.IdentifierExpression;
import org.pointerviz.compiler.frontend.parser.ast.LiteralExpression;
import org.pointerviz.compiler.frontend.parser.ast.NullPointerExpression;
import org.pointerviz.compiler.frontend.parser.ast.PointerDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.ReferenceDeclarationNode;
import org.pointerviz.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.pointerviz.model.MemoryGraph;
import org.pointerviz.model.MemoryObject;
import org.pointerviz.model.Pointer;
import org.pointerviz.model.Reference;
import org.pointerviz.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Resolves declaration source text into a {@link MemoryGraph}.
 * <p>
 * Statements are processed in source order. Each well-formed declaration yields exactly one object with a
 * fresh synthetic address; identifiers on the right-hand side are looked up among the objects declared
 * before the statement (first match wins). An identifier that cannot be found is not an error: the object
 * is created without a target and a warning is recorded. Malformed statements are reported as errors and
 * produce no object.
 * <p>
 * Thread Safety: instances hold no mutable state; all per-run state lives in a {@link ResolutionContext}
 * created by each call, so one resolver may be shared between threads.
 */
public class DeclarationResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationResolver.class);

    private static final String DEFAULT_SOURCE_NAME = "<input>";

    /**
     * Resolves a program read from an unnamed source.
     *
     * @param source The declaration text.
     * @return the graph and all diagnostics.
     */
    public ResolutionResult resolve(String source) {
        return resolve(source, DEFAULT_SOURCE_NAME);
    }

    /**
     * Resolves a program.
     *
     * @param source     The declaration text.
     * @param sourceName The logical name used in diagnostics, e.g. a file path.
     * @return the graph and all diagnostics.
     */
    public ResolutionResult resolve(String source, String sourceName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.setSource(sourceName, source);

        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        List<DeclarationNode> declarations = new Parser(tokens, diagnostics).parse();

        ResolutionContext context = new ResolutionContext();
        for (DeclarationNode declaration : declarations) {
            MemoryObject object = resolveDeclaration(declaration, context, diagnostics);
            context.declare(object);
            LOG.debug("Resolved {} '{}' at {} -> {}", object.kind(), object.name(), object.address(),
                    object.pointsTo().orElse("-"));
        }

        MemoryGraph graph = new MemoryGraph(context.declared());
        ResolutionResult result = new ResolutionResult(graph, diagnostics.getDiagnostics());
        LOG.debug("Resolved {} object(s) from {} with {} error(s) and {} warning(s)",
                graph.size(), sourceName, result.errors().size(), result.warnings().size());
        return result;
    }

    private MemoryObject resolveDeclaration(DeclarationNode declaration, ResolutionContext context,
                                            DiagnosticsEngine diagnostics) {
        if (declaration instanceof VariableDeclarationNode variable) {
            return resolveVariable(variable, context);
        }
        if (declaration instanceof PointerDeclarationNode pointer) {
            return resolvePointer(pointer, context, diagnostics);
        }
        if (declaration instanceof ReferenceDeclarationNode reference) {
            return resolveReference(reference, context, diagnostics);
        }
        throw new IllegalStateException("Unknown declaration node: " + declaration.getClass().getName());
    }

    private Variable resolveVariable(VariableDeclarationNode node, ResolutionContext context) {
        Object value = node.initializer() instanceof LiteralExpression literal
                ? literal.value()
                : node.initializer().text();
        return new Variable(node.name().text(), node.type().text(), context.allocateAddress(), value,
                node.leadingConst());
    }

    private Pointer resolvePointer(PointerDeclarationNode node, ResolutionContext context,
                                   DiagnosticsEngine diagnostics) {
        ExpressionNode initializer = node.initializer();
        String target = null;
        if (initializer instanceof AddressOfExpression addressOf) {
            Optional<MemoryObject> pointee = context.lookup(addressOf.name());
            if (pointee.isPresent()) {
                target = pointee.get().address();
            } else {
                reportUndeclared(addressOf.identifier(), node.name(), diagnostics);
            }
        } else if (initializer instanceof NullPointerExpression
                || (initializer instanceof LiteralExpression literal && literal.isZero())) {
            target = MemoryGraph.NULL_SENTINEL;
        } else {
            LOG.debug("Pointer '{}' initialized with '{}' has no resolvable target", node.name().text(),
                    initializer.text());
        }
        return new Pointer(node.name().text(), node.type().text(), context.allocateAddress(), target,
                node.leadingConst(), node.constAfterStar(), node.starCount());
    }

    private Reference resolveReference(ReferenceDeclarationNode node, ResolutionContext context,
                                       DiagnosticsEngine diagnostics) {
        ExpressionNode initializer = node.initializer();
        String target = null;
        Object value = null;

        if (initializer instanceof IdentifierExpression identifier) {
            Optional<MemoryObject> referent = context.lookup(identifier.name());
            if (referent.isPresent()) {
                target = referent.get().address();
                value = referent.get().value().orElse(null);
            } else {
                reportUndeclared(identifier.identifier(), node.name(), diagnostics);
            }
        } else if (initializer instanceof DereferenceExpression dereference) {
            Optional<MemoryObject> pointer = context.lookup(dereference.name());
            if (pointer.isEmpty()) {
                reportUndeclared(dereference.identifier(), node.name(), diagnostics);
            } else if (pointer.get().hasResolvedTarget()) {
                target = pointer.get().pointsTo().orElseThrow();
                value = context.lookupAddress(target).flatMap(MemoryObject::value).orElse(null);
            } else {
                Token operand = dereference.identifier();
                diagnostics.reportWarning("'" + operand.text() + "' does not point to a declared object; reference '"
                        + node.name().text() + "' is left unbound.", operand.line(), operand.column());
            }
        } else {
            if (initializer instanceof LiteralExpression literal) {
                value = literal.value();
            }
            Token first = initializer.firstToken();
            diagnostics.reportWarning("Reference '" + node.name().text() + "' is not bound to a declared object.",
                    first.line(), first.column());
        }

        return new Reference(node.name().text(), node.type().text(), context.allocateAddress(), target, value,
                node.leadingConst(), node.starCount());
    }

    private void reportUndeclared(Token identifier, Token declared, DiagnosticsEngine diagnostics) {
        LOG.debug("'{}' is not declared before '{}'", identifier.text(), declared.text());
        diagnostics.reportWarning("'" + identifier.text() + "' is not declared before this statement; '"
                + declared.text() + "' is left dangling.", identifier.line(), identifier.column());
    }
}
