package com.declfactory.generator.expansion.rewrite;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.declfactory.generator.expansion.ExpansionConfig;
import com.declfactory.generator.expansion.ExpansionContext;
import com.declfactory.generator.expansion.attribute.AttributeExtractor;
import com.declfactory.generator.expansion.attribute.Markers;
import com.declfactory.generator.expansion.declaration.Declaration;
import com.declfactory.generator.expansion.declaration.Declarations;
import com.declfactory.generator.expansion.declaration.StrippedDeclaration;
import com.declfactory.generator.expansion.exception.ExpansionException;
import com.declfactory.generator.expansion.instantiate.Instantiator;
import com.declfactory.generator.expansion.loop.CartesianExpander;
import com.declfactory.generator.expansion.loop.LoopDescriptorBuilder;
import com.declfactory.generator.expansion.model.ExpressionMatrix;
import com.declfactory.generator.expansion.model.LoopDescriptor;
import com.declfactory.generator.expansion.scope.BasisReader;
import com.declfactory.generator.expansion.scope.ScopeStack;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;

/**
 * Rewrites every block-like container of a tree, innermost first.
 *
 * For each container the direct members are walked in order. A scope-binding member is read
 * into a frame that stays visible to the members after it and is dropped from the output.
 * Every other member first has its own nested containers rewritten, then, if it carries loop
 * markers, is replaced by its expansion. Frames pushed by a container are released when the
 * container is done, even when the rewrite fails.
 */
public class TreeRewriteDriver extends VoidVisitorAdapter<ExpansionContext> {
    private static final Logger log = LoggerFactory.getLogger(TreeRewriteDriver.class);

    private final AttributeExtractor extractor;
    private final BasisReader basisReader;
    private final LoopDescriptorBuilder loopBuilder;
    private final CartesianExpander expander;
    private final String templateMarker;

    public TreeRewriteDriver(ExpansionConfig config) {
        this.extractor = new AttributeExtractor();
        this.basisReader = new BasisReader(extractor, config.getBasisMarker());
        this.loopBuilder = new LoopDescriptorBuilder();
        this.expander = new CartesianExpander(new Instantiator(), config.getEmptyMatrixPolicy());
        this.templateMarker = config.getTemplateMarker();
    }

    /**
     * Rewrites the tree under {@code root} in place.
     */
    public void rewrite(Node root, ExpansionContext context) {
        root.accept(this, context);
    }

    // ---- containers ----

    @Override
    public void visit(CompilationUnit n, ExpansionContext context) {
        n.setTypes(rewriteMembers(n.getTypes(), TreeRewriteDriver::asType, context));
    }

    @Override
    public void visit(ClassOrInterfaceDeclaration n, ExpansionContext context) {
        n.setMembers(rewriteMembers(n.getMembers(), TreeRewriteDriver::asMember, context));
    }

    @Override
    public void visit(RecordDeclaration n, ExpansionContext context) {
        n.setMembers(rewriteMembers(n.getMembers(), TreeRewriteDriver::asMember, context));
    }

    @Override
    public void visit(AnnotationDeclaration n, ExpansionContext context) {
        n.setMembers(rewriteMembers(n.getMembers(), TreeRewriteDriver::asMember, context));
    }

    @Override
    public void visit(EnumDeclaration n, ExpansionContext context) {
        n.setEntries(rewriteMembers(n.getEntries(), EnumConstantDeclaration.class::cast, context));
        n.setMembers(rewriteMembers(n.getMembers(), TreeRewriteDriver::asMember, context));
    }

    @Override
    public void visit(EnumConstantDeclaration n, ExpansionContext context) {
        n.getArguments().forEach(argument -> argument.accept(this, context));
        n.setClassBody(rewriteMembers(n.getClassBody(), TreeRewriteDriver::asMember, context));
    }

    @Override
    public void visit(ObjectCreationExpr n, ExpansionContext context) {
        n.getScope().ifPresent(scope -> scope.accept(this, context));
        n.getArguments().forEach(argument -> argument.accept(this, context));
        n.getAnonymousClassBody().ifPresent(
                body -> n.setAnonymousClassBody(rewriteMembers(body, TreeRewriteDriver::asMember, context)));
    }

    @Override
    public void visit(BlockStmt n, ExpansionContext context) {
        n.setStatements(rewrite(n.getStatements(), Declarations::ofStatement, Statement.class::cast, context));
    }

    @Override
    public void visit(SwitchEntry n, ExpansionContext context) {
        n.getLabels().forEach(label -> label.accept(this, context));
        n.setStatements(rewrite(n.getStatements(), Declarations::ofStatement, Statement.class::cast, context));
    }

    // ---- member lists ----

    private <N extends BodyDeclaration<?>> NodeList<N> rewriteMembers(NodeList<N> members, Function<Node, N> narrow,
            ExpansionContext context) {
        return rewrite(members, member -> Optional.of(Declarations.ofMember(member)), narrow, context);
    }

    /**
     * @param classify picks out the members that are declarations
     * @param narrow   restores an expanded instance to the container's element type
     */
    private <N extends Node> NodeList<N> rewrite(NodeList<N> members, Function<N, Optional<Declaration>> classify,
            Function<Node, N> narrow, ExpansionContext context) {
        ScopeStack scope = context.getScope();
        NodeList<N> rewritten = new NodeList<>();

        try (ScopeStack.Block block = scope.open()) {
            for (N member : members) {
                Optional<Declaration> declaration = classify.apply(member);
                if (declaration.isEmpty()) {
                    member.accept(this, context);
                    rewritten.add(member);
                    continue;
                }

                Optional<Map<String, ExpressionMatrix>> bindings = basisReader.read(declaration.get());
                if (bindings.isPresent()) {
                    if (Markers.anyNamed(declaration.get().getAttributes(), templateMarker)) {
                        throw new ExpansionException("A scope-binding declaration cannot also be a template",
                                member);
                    }
                    block.push(bindings.get());
                    context.getStats().recordBindings(bindings.get().size());
                    log.debug("Bound {} at scope depth {}", bindings.get().values(), scope.depth());
                    continue;
                }

                member.accept(this, context);
                for (Declaration instance : expand(declaration.get(), context)) {
                    rewritten.add(narrow.apply(instance.node()));
                }
            }
        }
        return rewritten;
    }

    private List<Declaration> expand(Declaration declaration, ExpansionContext context) {
        Optional<StrippedDeclaration<AnnotationExpr>> stripped =
                declaration.strip(extractor, Markers.named(templateMarker));
        if (stripped.isEmpty()) {
            return List.of(declaration);
        }
        LoopDescriptor loops = loopBuilder.build(stripped.get().markers(), context.getScope());
        List<Declaration> instances = expander.expand(stripped.get().template(), loops);
        context.getStats().recordExpansion(instances.size());
        log.debug("Expanded {} over {} into {} declaration(s)",
                declaration.describe(), loops.bindings(), instances.size());
        return instances;
    }

    private static BodyDeclaration<?> asMember(Node node) {
        return (BodyDeclaration<?>) node;
    }

    private static TypeDeclaration<?> asType(Node node) {
        return (TypeDeclaration<?>) node;
    }
}
