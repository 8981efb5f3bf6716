package me.christianrobert.hogql.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.hogql.config.service.ConfigService;
import me.christianrobert.hogql.context.ParseOutcome;
import me.christianrobert.hogql.parser.StartRule;
import me.christianrobert.hogql.service.HogQLParserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST endpoint for parsing HogQL into its AST.
 *
 * <p>Usage:
 * <pre>
 * # Parse an expression
 * curl -X POST "http://localhost:8080/api/hogql/expr" \
 *   -H "Content-Type: text/plain" \
 *   --data "a + b * 2"
 *
 * # Parse a statement and include the parse tree
 * curl -X POST "http://localhost:8080/api/hogql/select?showParseTree=true" \
 *   -H "Content-Type: text/plain" \
 *   --data "SELECT event FROM events WHERE timestamp > now()"
 * </pre>
 *
 * <p>Response format (JSON):
 * <pre>
 * {
 *   "success": false,
 *   "query": "arr[0]",
 *   "ast": null,
 *   "errorType": "SyntaxError",
 *   "errorMessage": "SQL indexes start from one, not from zero. E.g: array[1]",
 *   "start": 0,
 *   "end": 6,
 *   "parseTree": null
 * }
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A query that does not parse is a valid outcome, not an HTTP error.
 */
@Path("/api/hogql")
@Produces(MediaType.APPLICATION_JSON)
public class HogQLParseResource {

    private static final Logger log = LoggerFactory.getLogger(HogQLParseResource.class);

    @Inject
    HogQLParserService parserService;

    @Inject
    ConfigService configService;

    @POST
    @Path("/expr")
    @Consumes(MediaType.TEXT_PLAIN)
    public ParseOutcome parseExpr(@QueryParam("showParseTree") Boolean showParseTree, String query) {
        return analyze(query, StartRule.EXPR, showParseTree);
    }

    @POST
    @Path("/select")
    @Consumes(MediaType.TEXT_PLAIN)
    public ParseOutcome parseSelect(@QueryParam("showParseTree") Boolean showParseTree, String query) {
        return analyze(query, StartRule.SELECT, showParseTree);
    }

    @POST
    @Path("/order-expr")
    @Consumes(MediaType.TEXT_PLAIN)
    public ParseOutcome parseOrderExpr(@QueryParam("showParseTree") Boolean showParseTree, String query) {
        return analyze(query, StartRule.ORDER_EXPR, showParseTree);
    }

    private ParseOutcome analyze(String query, StartRule rule, Boolean showParseTree) {
        log.info("HogQL {} parse request received via REST API", rule.getDescription());
        log.trace("HogQL: {}", query);

        if (query == null || query.trim().isEmpty()) {
            log.warn("Empty query received");
            return ParseOutcome.failure("", "ParsingError", "Query cannot be empty");
        }

        // Fall back to the configured default when the flag is absent
        boolean includeParseTree = showParseTree != null ? showParseTree : configService.isIncludeParseTree();

        ParseOutcome outcome = parserService.analyze(query, rule, includeParseTree);
        if (outcome.isSuccess()) {
            log.info("HogQL parse succeeded");
            if (outcome.hasParseTree()) {
                log.debug("Parse tree included in response");
            }
        } else {
            log.warn("HogQL parse failed: {} {}", outcome.getErrorType(), outcome.getErrorMessage());
        }
        return outcome;
    }
}
