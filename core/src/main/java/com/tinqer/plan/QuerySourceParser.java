package com.tinqer.plan;

import com.tinqer.ast.ArrowFunctionNode;
import com.tinqer.cache.CachedParse;
import com.tinqer.cache.ParseCache;
import com.tinqer.logical.QueryOperation;
import com.tinqer.optimizer.PlanNormalizer;
import com.tinqer.visitor.QueryChainVisitor;
import com.tinqer.visitor.VisitorContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a query-construction lambda into a {@link CachedParse}, going
 * through the {@link ParseCache} for source text.
 */
final class QuerySourceParser {

    private static final Logger logger = LoggerFactory.getLogger(QuerySourceParser.class);

    private QuerySourceParser() {}

    static CachedParse parse(String source, ParseOptions options) {
        ParseCache cache = ParseCache.getInstance();
        boolean useCache = options == null || options.cache();
        if (useCache) {
            CachedParse cached = cache.get(source);
            if (cached != null) {
                return cached;
            }
        }

        CachedParse parsed = parse(PlanTransitions.lambda(source, "Query"));
        if (useCache) {
            cache.put(source, parsed);
        }
        return parsed;
    }

    static CachedParse parse(ArrowFunctionNode root) {
        VisitorContext ctx = new VisitorContext();
        QueryOperation operation = new QueryChainVisitor(ctx).visitQuery(root);
        QueryOperation normalized = PlanNormalizer.getDefault().normalize(operation);
        logger.debug("Parsed {} query with {} auto-parameters", normalized.operationType(), ctx.getAutoParams().size());
        return new CachedParse(normalized, ctx.getAutoParams(), ctx.getAutoParamInfos(), ctx.snapshot());
    }
}
