package com.pgschema.core.query;

import com.pgschema.core.MalformedRestrictionException;
import com.pgschema.core.catalog.ClauseMode;
import com.pgschema.core.catalog.CollectionDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a query template, its ordered restriction columns and a caller's
 * positional {@link RestrictionSet} into a parameterised {@link BoundStatement}.
 *
 * <h2>Predicate construction</h2>
 * Positions are walked from 0 up to the shorter of the two lists. Every present
 * restriction at position {@code i} appends
 * <pre>
 *   " WHERE " | " AND "   +   column(i) + " = :" + column(i)
 * </pre>
 * and binds the value under {@code column(i)}. The first predicate opens a
 * WHERE clause unless the template already ends in one
 * ({@link ClauseMode#AND}); absent positions are skipped without consuming a
 * keyword. Restriction values only ever travel as parameters; the only text
 * spliced into the statement is the column names the catalog declares.
 *
 * <p>The builder holds no mutable state and performs no I/O, so one instance
 * can serve any number of threads.
 */
public final class RestrictionQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(RestrictionQueryBuilder.class);

    private final RestrictionMode mode;

    public RestrictionQueryBuilder() {
        this(RestrictionMode.PERMISSIVE);
    }

    public RestrictionQueryBuilder(RestrictionMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public RestrictionMode getMode() { return mode; }

    /**
     * Builds the statement for a query-backed collection.
     *
     * @throws MalformedRestrictionException in {@link RestrictionMode#STRICT} mode
     *         when {@code restrictions} is longer than the collection's restriction columns
     * @throws IllegalArgumentException if the collection has no query template
     */
    public BoundStatement build(CollectionDescriptor collection, RestrictionSet restrictions)
            throws MalformedRestrictionException {
        if (collection.isStatic()) {
            throw new IllegalArgumentException("Collection '" + collection.getName() + "' is not query-backed");
        }
        checkLength(collection.getName(), collection.getRestrictionColumns(), restrictions);
        return build(collection.getQueryTemplate(), collection.getRestrictionColumns(),
                collection.getClauseMode(), restrictions);
    }

    /**
     * Appends one equality predicate per present restriction to {@code template}.
     * Length mismatches are always tolerated here.
     *
     * @param template           the base query
     * @param restrictionColumns restriction-eligible column names, in positional order
     * @param clauseMode         whether the first predicate opens a WHERE clause
     * @param restrictions       caller values; {@code null} means no restrictions
     * @return a fresh statement; the template unchanged when nothing is present
     */
    public BoundStatement build(String template,
                                List<String> restrictionColumns,
                                ClauseMode clauseMode,
                                RestrictionSet restrictions) {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(clauseMode, "clauseMode");

        StringBuilder text = new StringBuilder(template);
        List<BoundStatement.Parameter> parameters = new ArrayList<>();

        if (restrictions != null && restrictionColumns != null) {
            boolean addWhere = clauseMode == ClauseMode.WHERE;
            for (int i = 0; i < restrictions.size() && i < restrictionColumns.size(); i++) {
                if (!restrictions.isPresent(i)) continue;

                String column = restrictionColumns.get(i);
                if (addWhere) {
                    text.append(" WHERE ");
                    addWhere = false;
                } else {
                    text.append(" AND ");
                }
                text.append(column).append(" = :").append(column);
                parameters.add(new BoundStatement.Parameter(column, restrictions.get(i)));
            }
        }

        BoundStatement statement = new BoundStatement(text.toString(), parameters);
        log.debug("Built statement with {} restriction(s) {}", parameters.size(), statement.getParameterNames());
        return statement;
    }

    private void checkLength(String collection, List<String> columns, RestrictionSet restrictions)
            throws MalformedRestrictionException {
        if (mode != RestrictionMode.STRICT || restrictions == null) return;
        if (restrictions.size() > columns.size()) {
            throw new MalformedRestrictionException(String.format(
                    "Collection '%s' accepts at most %d restriction(s) %s but %d were given",
                    collection, columns.size(), columns, restrictions.size()));
        }
    }
}
