package work.upft.tokens.resolve;

import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.upft.tokens.ast.CrossFileEdge;
import work.upft.tokens.ast.FileAst;
import work.upft.tokens.ast.GroupNode;
import work.upft.tokens.ast.ProjectAst;
import work.upft.tokens.ast.ProjectBuilder;
import work.upft.tokens.ast.TokenNode;
import work.upft.tokens.graph.AstQuery;
import work.upft.tokens.graph.AstTraverser;
import work.upft.tokens.model.TokenReference;
import work.upft.tokens.model.TypedValue;
import work.upft.tokens.resolve.ResolutionError.Kind;

/**
 * Resolves token references in place.
 *
 * <p>Resolution runs in three passes: tokens with only local references first, then every
 * cross-file edge, then a second local pass for tokens that depended on cross-file results.
 * Problems are collected as {@link ResolutionError}s and the remaining tokens keep going.
 */
public final class ReferenceResolver {
    public static final int DEFAULT_MAX_DEPTH = 256;

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final int maxDepth;

    public ReferenceResolver() {
        this(DEFAULT_MAX_DEPTH);
    }

    public ReferenceResolver(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public ResolutionResult resolve(GroupNode root) {
        if (root instanceof FileAst file) {
            return resolveFile(file);
        }
        return resolveFile(FileAst.wrap(FileAst.INLINE_PATH, root));
    }

    public ResolutionResult resolveFile(FileAst file) {
        return resolveProject(ProjectBuilder.assemble("", List.of(file)));
    }

    public ResolutionResult resolveProject(ProjectAst project) {
        var ctx = new ResolutionContext(project, maxDepth);
        localPass(ctx, false);
        crossFilePass(ctx);
        localPass(ctx, true);

        int[] counts = new int[2];
        for (FileAst file : project.files().values()) {
            AstTraverser.visitTokens(file, token -> {
                counts[token.isResolved() ? 0 : 1]++;
                return true;
            });
        }
        log.debug("Resolved {} tokens, {} unresolved, {} errors", counts[0], counts[1], ctx.errors().size());
        return new ResolutionResult(ctx.errors(), counts[0], counts[1]);
    }

    private void localPass(ResolutionContext ctx, boolean crossFileAware) {
        ctx.beginPass();
        for (FileAst file : ctx.project().files().values()) {
            AstTraverser.visitTokens(file, token -> {
                if (!token.isResolved() && (crossFileAware || !token.hasCrossFileReferences())) {
                    resolveToken(ctx, file, token, crossFileAware);
                }
                return true;
            });
        }
    }

    private void crossFilePass(ResolutionContext ctx) {
        ctx.beginPass();
        var project = ctx.project();
        project.crossFileReferences().forEach((filePath, edges) -> {
            var source = project.file(filePath).orElseThrow();
            for (CrossFileEdge edge : edges) {
                var sourceToken = AstQuery.getToken(source, edge.fromToken());
                if (sourceToken.isEmpty() || sourceToken.get().isResolved()) {
                    continue;
                }
                var target = locateCrossFile(ctx, source, sourceToken.get(), edge);
                if (target.isEmpty()) {
                    continue;
                }
                var value = resolveToken(ctx, target.get().file(), target.get().token(), true);
                if (value.isPresent()) {
                    var key = ResolutionContext.key(source, sourceToken.get());
                    ctx.substitute(key, sourceToken.get(), edge.reference(), value.get());
                    ctx.completeIfDone(key, sourceToken.get());
                }
            }
        });
    }

    private Optional<TypedValue> resolveToken(ResolutionContext ctx, FileAst file, TokenNode token, boolean crossFileAware) {
        if (token.isResolved()) {
            return token.resolvedValue();
        }
        var key = ResolutionContext.key(file, token);
        var memo = ctx.memoized(key);
        if (memo.isPresent() || ctx.hasFailed(key)) {
            return memo;
        }
        if (ctx.isVisiting(key)) {
            ctx.error(ResolutionError.of(Kind.CIRCULAR, token.path(), "Circular reference detected", null, file.filePath()));
            return Optional.empty();
        }
        if (ctx.depthExceeded()) {
            ctx.error(ResolutionError.of(Kind.DEPTH, token.path(), "Reference chain deeper than " + ctx.maxDepth(), null, file.filePath()));
            return Optional.empty();
        }
        if (!crossFileAware && token.hasCrossFileReferences()) {
            return Optional.empty();
        }

        ctx.enter(key);
        try {
            for (TokenReference ref : token.references()) {
                if (ctx.isSubstituted(key, ref)) {
                    continue;
                }
                var target = ref.isLocal()
                    ? locateLocal(ctx, file, token, ref)
                    : ctx.edge(file, token, ref).flatMap(edge -> locateCrossFile(ctx, file, token, edge));
                if (target.isEmpty()) {
                    continue;
                }
                var value = resolveToken(ctx, target.get().file(), target.get().token(), crossFileAware);
                value.ifPresent(v -> ctx.substitute(key, token, ref, v));
            }
        } finally {
            ctx.exit(key);
        }

        var resolved = ctx.completeIfDone(key, token);
        if (resolved.isEmpty()) {
            ctx.markFailed(key);
        }
        return resolved;
    }

    private Optional<Target> locateLocal(ResolutionContext ctx, FileAst file, TokenNode token, TokenReference ref) {
        var node = AstQuery.findNode(file, ref.path());
        if (node.isPresent() && node.get() instanceof TokenNode target) {
            return Optional.of(new Target(file, target));
        }
        if (node.isPresent()) {
            ctx.error(ResolutionError.of(Kind.INVALID, token.path(), "Reference " + ref + " points to a group, not a token", ref.literal(), file.filePath()));
            return Optional.empty();
        }
        for (FileAst other : ctx.project().files().values()) {
            if (other == file) {
                continue;
            }
            var candidate = AstQuery.getToken(other, ref.path());
            if (candidate.isPresent()) {
                return Optional.of(new Target(other, candidate.get()));
            }
        }
        ctx.error(ResolutionError.of(Kind.MISSING, token.path(), "Reference not found: " + ref, ref.literal(), file.filePath()));
        return Optional.empty();
    }

    private Optional<Target> locateCrossFile(ResolutionContext ctx, FileAst file, TokenNode token, CrossFileEdge edge) {
        var targetFile = ctx.project().file(edge.toFile());
        if (targetFile.isEmpty()) {
            if (edge.toFile().startsWith("http://") || edge.toFile().startsWith("https://")) {
                log.warn("Remote file {} referenced by {} was not loaded", edge.toFile(), token.path());
            }
            ctx.error(ResolutionError.crossFile(token.path(), "Target file not found: " + edge.toFile(), edge.literal(), file.filePath(), edge.toFile()));
            return Optional.empty();
        }
        var targetToken = AstQuery.getToken(targetFile.get(), edge.toToken());
        if (targetToken.isEmpty()) {
            ctx.error(ResolutionError.crossFile(token.path(), "Target token not found: " + edge.toToken() + " in " + edge.toFile(), edge.literal(), file.filePath(), edge.toFile()));
            return Optional.empty();
        }
        return Optional.of(new Target(targetFile.get(), targetToken.get()));
    }

    private record Target(FileAst file, TokenNode token) {}
}
