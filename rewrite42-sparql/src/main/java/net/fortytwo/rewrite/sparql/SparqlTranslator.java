package net.fortytwo.rewrite.sparql;

import net.fortytwo.rewrite.algebra.AggregatePattern;
import net.fortytwo.rewrite.algebra.BasicGraphPattern;
import net.fortytwo.rewrite.algebra.BindPattern;
import net.fortytwo.rewrite.algebra.DistinctPattern;
import net.fortytwo.rewrite.algebra.EmptyPattern;
import net.fortytwo.rewrite.algebra.FilterPattern;
import net.fortytwo.rewrite.algebra.GraphScope;
import net.fortytwo.rewrite.algebra.JoinPattern;
import net.fortytwo.rewrite.algebra.OptionalPattern;
import net.fortytwo.rewrite.algebra.OrderPattern;
import net.fortytwo.rewrite.algebra.PathPattern;
import net.fortytwo.rewrite.algebra.Pattern;
import net.fortytwo.rewrite.algebra.ProjectionPattern;
import net.fortytwo.rewrite.algebra.SingletonPattern;
import net.fortytwo.rewrite.algebra.SlicePattern;
import net.fortytwo.rewrite.algebra.TriplePattern;
import net.fortytwo.rewrite.algebra.UnionPattern;
import net.fortytwo.rewrite.algebra.ValuesPattern;
import net.fortytwo.rewrite.expr.BoundExpression;
import net.fortytwo.rewrite.expr.CoalesceExpression;
import net.fortytwo.rewrite.expr.CompareExpression;
import net.fortytwo.rewrite.expr.ConstantExpression;
import net.fortytwo.rewrite.expr.ExistsExpression;
import net.fortytwo.rewrite.expr.Expression;
import net.fortytwo.rewrite.expr.FunctionExpression;
import net.fortytwo.rewrite.expr.IfExpression;
import net.fortytwo.rewrite.expr.InExpression;
import net.fortytwo.rewrite.expr.LogicalExpression;
import net.fortytwo.rewrite.expr.NotExpression;
import net.fortytwo.rewrite.expr.RegexExpression;
import net.fortytwo.rewrite.expr.SameTermExpression;
import net.fortytwo.rewrite.expr.TypeTestExpression;
import net.fortytwo.rewrite.expr.VarExpression;
import net.fortytwo.rewrite.model.Solution;
import net.fortytwo.rewrite.model.VariableOrConstant;
import net.fortytwo.rewrite.path.Path;
import net.fortytwo.rewrite.template.TemplateTriple;
import org.openrdf.model.BNode;
import org.openrdf.model.IRI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.query.BindingSet;
import org.openrdf.query.algebra.AggregateOperator;
import org.openrdf.query.algebra.And;
import org.openrdf.query.algebra.ArbitraryLengthPath;
import org.openrdf.query.algebra.BNodeGenerator;
import org.openrdf.query.algebra.BindingSetAssignment;
import org.openrdf.query.algebra.Bound;
import org.openrdf.query.algebra.Coalesce;
import org.openrdf.query.algebra.Compare;
import org.openrdf.query.algebra.Count;
import org.openrdf.query.algebra.Datatype;
import org.openrdf.query.algebra.Distinct;
import org.openrdf.query.algebra.EmptySet;
import org.openrdf.query.algebra.Exists;
import org.openrdf.query.algebra.Extension;
import org.openrdf.query.algebra.ExtensionElem;
import org.openrdf.query.algebra.Filter;
import org.openrdf.query.algebra.FunctionCall;
import org.openrdf.query.algebra.Group;
import org.openrdf.query.algebra.GroupConcat;
import org.openrdf.query.algebra.GroupElem;
import org.openrdf.query.algebra.IRIFunction;
import org.openrdf.query.algebra.If;
import org.openrdf.query.algebra.IsBNode;
import org.openrdf.query.algebra.IsLiteral;
import org.openrdf.query.algebra.IsNumeric;
import org.openrdf.query.algebra.IsURI;
import org.openrdf.query.algebra.Join;
import org.openrdf.query.algebra.Lang;
import org.openrdf.query.algebra.LeftJoin;
import org.openrdf.query.algebra.ListMemberOperator;
import org.openrdf.query.algebra.Max;
import org.openrdf.query.algebra.Min;
import org.openrdf.query.algebra.Modify;
import org.openrdf.query.algebra.MultiProjection;
import org.openrdf.query.algebra.Not;
import org.openrdf.query.algebra.Or;
import org.openrdf.query.algebra.Order;
import org.openrdf.query.algebra.OrderElem;
import org.openrdf.query.algebra.Projection;
import org.openrdf.query.algebra.ProjectionElem;
import org.openrdf.query.algebra.ProjectionElemList;
import org.openrdf.query.algebra.QueryRoot;
import org.openrdf.query.algebra.Reduced;
import org.openrdf.query.algebra.Regex;
import org.openrdf.query.algebra.SameTerm;
import org.openrdf.query.algebra.Sample;
import org.openrdf.query.algebra.SingletonSet;
import org.openrdf.query.algebra.Slice;
import org.openrdf.query.algebra.StatementPattern;
import org.openrdf.query.algebra.Str;
import org.openrdf.query.algebra.TupleExpr;
import org.openrdf.query.algebra.UnaryValueOperator;
import org.openrdf.query.algebra.Union;
import org.openrdf.query.algebra.ValueConstant;
import org.openrdf.query.algebra.ValueExpr;
import org.openrdf.query.algebra.Var;
import org.openrdf.query.algebra.ZeroLengthPath;
import org.openrdf.query.algebra.helpers.StatementPatternCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Translates the query algebra of the Sesame SPARQL parser into patterns, expressions and templates.
 * Operators with no counterpart in the pattern language are rejected.
 *
 * @author Joshua Shinavier (http://fortytwo.net)
 */
public class SparqlTranslator {
    private static final Logger logger = Logger.getLogger(SparqlTranslator.class.getName());

    private static final String
            SUBJECT = "subject",
            PREDICATE = "predicate",
            OBJECT = "object",
            CONTEXT = "context";

    private final ValueFactory valueFactory;
    private final IRI defaultGraph;

    /**
     * @param defaultGraph a named graph which stands in for the default graph (as with FROM or WITH),
     *                     or null for the default graph of the dataset
     */
    public SparqlTranslator(final ValueFactory valueFactory, final IRI defaultGraph) {
        this.valueFactory = valueFactory;
        this.defaultGraph = defaultGraph;
    }

    public SparqlQuery translateSelect(final TupleExpr expr) throws QueryEngine.IncompatibleQueryException {
        Pattern pattern = translate(expr);
        List<String> names = findProjectedNames(expr);
        if (null == names) {
            names = new LinkedList<>(pattern.getVariables());
        }
        return SparqlQuery.select(pattern, names);
    }

    public SparqlQuery translateAsk(final TupleExpr expr) throws QueryEngine.IncompatibleQueryException {
        return SparqlQuery.ask(translate(expr));
    }

    public SparqlQuery translateConstruct(final TupleExpr expr) throws QueryEngine.IncompatibleQueryException {
        TupleExpr root = expr instanceof QueryRoot ? ((QueryRoot) expr).getArg() : expr;

        Slice slice = null;
        while (root instanceof Reduced || root instanceof Distinct || root instanceof Slice) {
            if (root instanceof Slice) {
                slice = (Slice) root;
                root = slice.getArg();
            } else if (root instanceof Reduced) {
                root = ((Reduced) root).getArg();
            } else {
                root = ((Distinct) root).getArg();
            }
        }

        List<ProjectionElemList> projections;
        TupleExpr where;
        if (root instanceof Projection) {
            projections = Collections.singletonList(((Projection) root).getProjectionElemList());
            where = ((Projection) root).getArg();
        } else if (root instanceof MultiProjection) {
            projections = ((MultiProjection) root).getProjections();
            where = ((MultiProjection) root).getArg();
        } else {
            throw new QueryEngine.IncompatibleQueryException(
                    "expected projection beneath CONSTRUCT; found " + root.getClass().getSimpleName());
        }

        Set<String> sources = new LinkedHashSet<>();
        for (ProjectionElemList pl : projections) {
            for (ProjectionElem pe : pl.getElements()) {
                sources.add(pe.getSourceName());
            }
        }

        // constants and blank nodes of the template are bound by an extension beneath the projection
        Map<String, Value> constants = new HashMap<>();
        List<BindPattern.Assignment> assignments = new LinkedList<>();
        if (where instanceof Extension) {
            Extension ext = (Extension) where;
            for (ExtensionElem ee : ext.getElements()) {
                ValueExpr ve = ee.getExpr();
                if (sources.contains(ee.getName()) && ve instanceof ValueConstant) {
                    constants.put(ee.getName(), ((ValueConstant) ve).getValue());
                } else if (sources.contains(ee.getName()) && ve instanceof BNodeGenerator) {
                    constants.put(ee.getName(), valueFactory.createBNode(ee.getName()));
                } else if (!isIdentity(ee)) {
                    assignments.add(new BindPattern.Assignment(ee.getName(), translate(ve)));
                }
            }
            where = ext.getArg();
        }

        Pattern pattern = translate(where);
        if (!assignments.isEmpty()) {
            pattern = new BindPattern(pattern, assignments);
        }
        if (null != slice) {
            pattern = new SlicePattern(pattern,
                    slice.hasOffset() ? slice.getOffset() : 0,
                    slice.hasLimit() ? slice.getLimit() : -1);
        }

        List<TemplateTriple> template = new LinkedList<>();
        for (ProjectionElemList pl : projections) {
            Map<String, String> targetToSource = new HashMap<>();
            for (ProjectionElem pe : pl.getElements()) {
                targetToSource.put(pe.getTargetName(), pe.getSourceName());
            }

            String context = targetToSource.get(CONTEXT);
            template.add(new TemplateTriple(
                    templateTerm(targetToSource.get(SUBJECT), constants),
                    templateTerm(targetToSource.get(PREDICATE), constants),
                    templateTerm(targetToSource.get(OBJECT), constants),
                    null == context ? null : templateTerm(context, constants)));
        }

        return SparqlQuery.construct(pattern, template);
    }

    /**
     * @param modify  a DELETE/INSERT operation
     * @param dataset the dataset clause of the operation (WITH, USING), or null
     */
    public static SparqlQuery translateModify(final Modify modify,
                                              final org.openrdf.query.Dataset dataset,
                                              final ValueFactory valueFactory)
            throws QueryEngine.IncompatibleQueryException {
        IRI whereGraph = singleGraph(null == dataset ? null : dataset.getDefaultGraphs());
        IRI removeGraph = singleGraph(null == dataset ? null : dataset.getDefaultRemoveGraphs());
        IRI insertGraph = null == dataset ? null : dataset.getDefaultInsertGraph();

        SparqlTranslator translator = new SparqlTranslator(valueFactory, whereGraph);
        Pattern pattern = null == modify.getWhereExpr()
                ? SingletonPattern.INSTANCE
                : translator.translate(modify.getWhereExpr());

        return SparqlQuery.update(pattern,
                translator.toTemplate(modify.getDeleteExpr(), removeGraph),
                translator.toTemplate(modify.getInsertExpr(), insertGraph));
    }

    /**
     * @return the graph of a dataset clause naming exactly one graph, or null if it names none
     */
    static IRI singleGraph(final Set<IRI> graphs) throws QueryEngine.IncompatibleQueryException {
        if (null == graphs || graphs.isEmpty()) {
            return null;
        }
        if (graphs.size() > 1) {
            throw new QueryEngine.IncompatibleQueryException("a default graph merged from several graphs is not supported");
        }
        return graphs.iterator().next();
    }

    public Pattern translate(final TupleExpr expr) throws QueryEngine.IncompatibleQueryException {
        if (expr instanceof QueryRoot) {
            return translate(((QueryRoot) expr).getArg());
        } else if (expr instanceof StatementPattern) {
            return translate((StatementPattern) expr);
        } else if (expr instanceof ArbitraryLengthPath) {
            return translate((ArbitraryLengthPath) expr);
        } else if (expr instanceof ZeroLengthPath) {
            ZeroLengthPath z = (ZeroLengthPath) expr;
            return singleton(new PathPattern(toNative(z.getSubjectVar()), Path.identity(), toNative(z.getObjectVar()),
                    toScope(z.getScope(), z.getContextVar())));
        } else if (expr instanceof Join) {
            return translate((Join) expr);
        } else if (expr instanceof Union) {
            return translate((Union) expr);
        } else if (expr instanceof LeftJoin) {
            LeftJoin lj = (LeftJoin) expr;
            return new OptionalPattern(translate(lj.getLeftArg()), translate(lj.getRightArg()),
                    null == lj.getCondition() ? null : translate(lj.getCondition()));
        } else if (expr instanceof Filter) {
            Filter f = (Filter) expr;
            return new FilterPattern(translate(f.getArg()), translate(f.getCondition()));
        } else if (expr instanceof Extension) {
            return translate((Extension) expr);
        } else if (expr instanceof Group) {
            return translate((Group) expr);
        } else if (expr instanceof Order) {
            Order o = (Order) expr;
            List<OrderPattern.OrderCondition> conditions = new LinkedList<>();
            for (OrderElem oe : o.getElements()) {
                conditions.add(new OrderPattern.OrderCondition(translate(oe.getExpr()), oe.isAscending()));
            }
            return new OrderPattern(translate(o.getArg()), conditions);
        } else if (expr instanceof Projection) {
            Projection p = (Projection) expr;
            Map<String, String> targetToSource = new LinkedHashMap<>();
            for (ProjectionElem pe : p.getProjectionElemList().getElements()) {
                targetToSource.put(pe.getTargetName(), pe.getSourceName());
            }
            return new ProjectionPattern(translate(p.getArg()), targetToSource);
        } else if (expr instanceof Distinct) {
            return new DistinctPattern(translate(((Distinct) expr).getArg()), false);
        } else if (expr instanceof Reduced) {
            return new DistinctPattern(translate(((Reduced) expr).getArg()), true);
        } else if (expr instanceof Slice) {
            Slice s = (Slice) expr;
            return new SlicePattern(translate(s.getArg()),
                    s.hasOffset() ? s.getOffset() : 0,
                    s.hasLimit() ? s.getLimit() : -1);
        } else if (expr instanceof BindingSetAssignment) {
            return translate((BindingSetAssignment) expr);
        } else if (expr instanceof SingletonSet) {
            return SingletonPattern.INSTANCE;
        } else if (expr instanceof EmptySet) {
            return EmptyPattern.INSTANCE;
        } else {
            throw new QueryEngine.IncompatibleQueryException(
                    "unsupported operator: " + expr.getClass().getSimpleName());
        }
    }

    private Pattern translate(final StatementPattern sp) {
        return singleton(new TriplePattern(
                toNative(sp.getSubjectVar()),
                toNative(sp.getPredicateVar()),
                toNative(sp.getObjectVar()),
                toScope(sp.getScope(), sp.getContextVar())));
    }

    private Pattern translate(final ArbitraryLengthPath alp) throws QueryEngine.IncompatibleQueryException {
        Path path = toPath(alp, alp.getSubjectVar().getName(), alp.getObjectVar().getName());
        if (null == path) {
            throw new QueryEngine.IncompatibleQueryException("unsupported property path: " + alp.getPathExpression());
        }

        return singleton(new PathPattern(toNative(alp.getSubjectVar()), path, toNative(alp.getObjectVar()),
                toScope(alp.getScope(), alp.getContextVar())));
    }

    // basic graph patterns continue across joins; any other operand closes the current one
    private Pattern translate(final Join join) throws QueryEngine.IncompatibleQueryException {
        List<TupleExpr> args = new LinkedList<>();
        collectJoinArgs(join, args);

        Pattern result = null;
        for (TupleExpr arg : args) {
            Pattern p = translate(arg);
            if (null == result) {
                result = p;
            } else if (result instanceof BasicGraphPattern && p instanceof BasicGraphPattern) {
                List<Pattern> patterns = new ArrayList<>(((BasicGraphPattern) result).getPatterns());
                patterns.addAll(((BasicGraphPattern) p).getPatterns());
                result = new BasicGraphPattern(patterns);
            } else {
                checkConnected(result);
                result = new JoinPattern(result, p);
            }
        }

        checkConnected(result);
        return result;
    }

    private void collectJoinArgs(final TupleExpr expr, final List<TupleExpr> args) {
        if (expr instanceof Join) {
            collectJoinArgs(((Join) expr).getLeftArg(), args);
            collectJoinArgs(((Join) expr).getRightArg(), args);
        } else {
            args.add(expr);
        }
    }

    private void checkConnected(final Pattern p) {
        if (p instanceof BasicGraphPattern && !((BasicGraphPattern) p).isConnected()) {
            logger.warning("basic graph pattern is not connected; evaluating as a cross product: " + p);
        }
    }

    private Pattern translate(final Union union) throws QueryEngine.IncompatibleQueryException {
        // (p)? arrives as the union of a zero-length path with p
        ZeroLengthPath zlp = union.getLeftArg() instanceof ZeroLengthPath
                ? (ZeroLengthPath) union.getLeftArg()
                : union.getRightArg() instanceof ZeroLengthPath
                ? (ZeroLengthPath) union.getRightArg()
                : null;
        if (null != zlp) {
            Path path = toPath(union, zlp.getSubjectVar().getName(), zlp.getObjectVar().getName());
            if (null != path) {
                return singleton(new PathPattern(toNative(zlp.getSubjectVar()), path, toNative(zlp.getObjectVar()),
                        toScope(zlp.getScope(), zlp.getContextVar())));
            }
        }

        return new UnionPattern(translate(union.getLeftArg()), translate(union.getRightArg()));
    }

    private Pattern translate(final Extension ext) throws QueryEngine.IncompatibleQueryException {
        List<BindPattern.Assignment> assignments = new LinkedList<>();
        for (ExtensionElem ee : ext.getElements()) {
            // aggregates are computed by the group beneath
            if (ee.getExpr() instanceof AggregateOperator || isIdentity(ee)) {
                continue;
            }
            assignments.add(new BindPattern.Assignment(ee.getName(), translate(ee.getExpr())));
        }

        Pattern inner = translate(ext.getArg());
        return assignments.isEmpty() ? inner : new BindPattern(inner, assignments);
    }

    private boolean isIdentity(final ExtensionElem ee) {
        return ee.getExpr() instanceof Var
                && !((Var) ee.getExpr()).hasValue()
                && ((Var) ee.getExpr()).getName().equals(ee.getName());
    }

    private Pattern translate(final Group group) throws QueryEngine.IncompatibleQueryException {
        List<AggregatePattern.Aggregate> aggregates = new LinkedList<>();
        for (GroupElem ge : group.getGroupElements()) {
            aggregates.add(toAggregate(ge.getName(), ge.getOperator()));
        }

        return new AggregatePattern(translate(group.getArg()),
                new ArrayList<>(group.getGroupBindingNames()), aggregates);
    }

    private AggregatePattern.Aggregate toAggregate(final String name, final AggregateOperator op)
            throws QueryEngine.IncompatibleQueryException {
        ValueExpr arg = op instanceof UnaryValueOperator ? ((UnaryValueOperator) op).getArg() : null;
        Expression e = null == arg ? null : translate(arg);

        if (op instanceof Count) {
            return new AggregatePattern.Aggregate(name, AggregatePattern.Function.COUNT, e, op.isDistinct(), null);
        } else if (op instanceof Sample) {
            return new AggregatePattern.Aggregate(name, AggregatePattern.Function.SAMPLE, e, op.isDistinct(), null);
        } else if (op instanceof Min) {
            return new AggregatePattern.Aggregate(name, AggregatePattern.Function.MIN, e, op.isDistinct(), null);
        } else if (op instanceof Max) {
            return new AggregatePattern.Aggregate(name, AggregatePattern.Function.MAX, e, op.isDistinct(), null);
        } else if (op instanceof GroupConcat) {
            ValueExpr sep = ((GroupConcat) op).getSeparator();
            String separator = null;
            if (sep instanceof ValueConstant) {
                separator = ((ValueConstant) sep).getValue().stringValue();
            } else if (null != sep) {
                throw new QueryEngine.IncompatibleQueryException("GROUP_CONCAT separator must be a constant");
            }
            return new AggregatePattern.Aggregate(
                    name, AggregatePattern.Function.GROUP_CONCAT, e, op.isDistinct(), separator);
        } else {
            throw new QueryEngine.IncompatibleQueryException(
                    "unsupported aggregate: " + op.getClass().getSimpleName());
        }
    }

    private Pattern translate(final BindingSetAssignment bsa) {
        List<String> names = new ArrayList<>(bsa.getBindingNames());
        List<Solution> rows = new LinkedList<>();
        for (BindingSet bs : bsa.getBindingSets()) {
            Map<String, Value> row = new HashMap<>();
            for (String name : names) {
                row.put(name, bs.getValue(name));
            }
            rows.add(Solution.of(row));
        }
        return new ValuesPattern(names, rows);
    }

    public Expression translate(final ValueExpr expr) throws QueryEngine.IncompatibleQueryException {
        if (expr instanceof Var) {
            Var v = (Var) expr;
            return v.hasValue() ? new ConstantExpression(v.getValue()) : new VarExpression(v.getName());
        } else if (expr instanceof ValueConstant) {
            return new ConstantExpression(((ValueConstant) expr).getValue());
        } else if (expr instanceof And) {
            And a = (And) expr;
            return new LogicalExpression(LogicalExpression.Operator.AND,
                    translate(a.getLeftArg()), translate(a.getRightArg()));
        } else if (expr instanceof Or) {
            Or o = (Or) expr;
            return new LogicalExpression(LogicalExpression.Operator.OR,
                    translate(o.getLeftArg()), translate(o.getRightArg()));
        } else if (expr instanceof Not) {
            ValueExpr arg = ((Not) expr).getArg();
            if (arg instanceof Exists) {
                return new ExistsExpression(translate(((Exists) arg).getSubQuery()), true);
            } else if (arg instanceof ListMemberOperator) {
                return toIn((ListMemberOperator) arg, true);
            } else {
                return new NotExpression(translate(arg));
            }
        } else if (expr instanceof Exists) {
            return new ExistsExpression(translate(((Exists) expr).getSubQuery()), false);
        } else if (expr instanceof Compare) {
            Compare c = (Compare) expr;
            return new CompareExpression(toOperator(c.getOperator()),
                    translate(c.getLeftArg()), translate(c.getRightArg()));
        } else if (expr instanceof SameTerm) {
            SameTerm st = (SameTerm) expr;
            return new SameTermExpression(translate(st.getLeftArg()), translate(st.getRightArg()));
        } else if (expr instanceof Bound) {
            return new BoundExpression(((Bound) expr).getArg().getName());
        } else if (expr instanceof IsURI) {
            return new TypeTestExpression(TypeTestExpression.Kind.IRI, translate(((IsURI) expr).getArg()));
        } else if (expr instanceof IsBNode) {
            return new TypeTestExpression(TypeTestExpression.Kind.BLANK, translate(((IsBNode) expr).getArg()));
        } else if (expr instanceof IsLiteral) {
            return new TypeTestExpression(TypeTestExpression.Kind.LITERAL, translate(((IsLiteral) expr).getArg()));
        } else if (expr instanceof IsNumeric) {
            return new TypeTestExpression(TypeTestExpression.Kind.NUMERIC, translate(((IsNumeric) expr).getArg()));
        } else if (expr instanceof Regex) {
            Regex r = (Regex) expr;
            return new RegexExpression(translate(r.getArg()), translate(r.getPatternArg()),
                    null == r.getFlagsArg() ? null : translate(r.getFlagsArg()));
        } else if (expr instanceof Str) {
            return function(FunctionExpression.Function.STR, ((Str) expr).getArg());
        } else if (expr instanceof IRIFunction) {
            return function(FunctionExpression.Function.IRI, ((IRIFunction) expr).getArg());
        } else if (expr instanceof Lang) {
            return function(FunctionExpression.Function.LANG, ((Lang) expr).getArg());
        } else if (expr instanceof Datatype) {
            return function(FunctionExpression.Function.DATATYPE, ((Datatype) expr).getArg());
        } else if (expr instanceof If) {
            If i = (If) expr;
            return new IfExpression(translate(i.getCondition()), translate(i.getResult()),
                    translate(i.getAlternative()));
        } else if (expr instanceof Coalesce) {
            return new CoalesceExpression(translate(((Coalesce) expr).getArguments()));
        } else if (expr instanceof ListMemberOperator) {
            return toIn((ListMemberOperator) expr, false);
        } else if (expr instanceof FunctionCall) {
            FunctionCall fc = (FunctionCall) expr;
            FunctionExpression.Function f = FunctionExpression.Function.forIri(fc.getURI());
            if (null == f) {
                throw new QueryEngine.IncompatibleQueryException("unsupported function: " + fc.getURI());
            }
            return function(f, fc.getArgs());
        } else {
            throw new QueryEngine.IncompatibleQueryException(
                    "unsupported expression: " + expr.getClass().getSimpleName());
        }
    }

    private List<Expression> translate(final List<ValueExpr> exprs) throws QueryEngine.IncompatibleQueryException {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (ValueExpr e : exprs) {
            result.add(translate(e));
        }
        return result;
    }

    private Expression function(final FunctionExpression.Function f, final ValueExpr arg)
            throws QueryEngine.IncompatibleQueryException {
        return function(f, Collections.singletonList(arg));
    }

    private Expression function(final FunctionExpression.Function f, final List<ValueExpr> args)
            throws QueryEngine.IncompatibleQueryException {
        try {
            return new FunctionExpression(f, translate(args));
        } catch (IllegalArgumentException e) {
            throw new QueryEngine.IncompatibleQueryException(e.getMessage());
        }
    }

    private Expression toIn(final ListMemberOperator op, final boolean negated)
            throws QueryEngine.IncompatibleQueryException {
        List<Expression> args = translate(op.getArguments());
        return new InExpression(args.get(0), args.subList(1, args.size()), negated);
    }

    private CompareExpression.Operator toOperator(final Compare.CompareOp op) {
        switch (op) {
            case EQ:
                return CompareExpression.Operator.EQ;
            case NE:
                return CompareExpression.Operator.NE;
            case LT:
                return CompareExpression.Operator.LT;
            case LE:
                return CompareExpression.Operator.LE;
            case GT:
                return CompareExpression.Operator.GT;
            case GE:
                return CompareExpression.Operator.GE;
            default:
                throw new IllegalStateException("unexpected comparison operator: " + op);
        }
    }

    /**
     * Converts the expansion of a property path back into a path
     *
     * @param start the name of the variable at which the path begins
     * @param end   the name of the variable at which the path ends
     * @return the path, or null if the expression is not a path between the two variables
     */
    private Path toPath(final TupleExpr expr, final String start, final String end) {
        if (expr instanceof StatementPattern) {
            StatementPattern sp = (StatementPattern) expr;
            Var p = sp.getPredicateVar();
            if (!p.hasValue() || !(p.getValue() instanceof IRI)) {
                return null;
            }
            Path atomic = Path.atomic((IRI) p.getValue());
            String s = sp.getSubjectVar().getName();
            String o = sp.getObjectVar().getName();
            if (s.equals(start) && o.equals(end)) {
                return atomic;
            } else if (s.equals(end) && o.equals(start)) {
                return Path.inverse(atomic);
            } else {
                return null;
            }
        } else if (expr instanceof ZeroLengthPath) {
            ZeroLengthPath z = (ZeroLengthPath) expr;
            return connects(z.getSubjectVar(), z.getObjectVar(), start, end) ? Path.identity() : null;
        } else if (expr instanceof ArbitraryLengthPath) {
            ArbitraryLengthPath alp = (ArbitraryLengthPath) expr;
            String s = alp.getSubjectVar().getName();
            String o = alp.getObjectVar().getName();
            Path inner = toPath(alp.getPathExpression(), s, o);
            if (null == inner || alp.getMinLength() > 1) {
                return null;
            }
            Path closure = 0 == alp.getMinLength() ? Path.zeroOrMore(inner) : Path.oneOrMore(inner);
            if (s.equals(start) && o.equals(end)) {
                return closure;
            } else if (s.equals(end) && o.equals(start)) {
                return Path.inverse(closure);
            } else {
                return null;
            }
        } else if (expr instanceof Union) {
            Union u = (Union) expr;
            if (u.getLeftArg() instanceof ZeroLengthPath || u.getRightArg() instanceof ZeroLengthPath) {
                ZeroLengthPath z = (ZeroLengthPath) (u.getLeftArg() instanceof ZeroLengthPath
                        ? u.getLeftArg() : u.getRightArg());
                TupleExpr other = u.getLeftArg() == z ? u.getRightArg() : u.getLeftArg();
                Path p = toPath(other, start, end);
                return null == p || !connects(z.getSubjectVar(), z.getObjectVar(), start, end)
                        ? null : Path.zeroOrOne(p);
            }
            Path l = toPath(u.getLeftArg(), start, end);
            Path r = toPath(u.getRightArg(), start, end);
            return null == l || null == r ? null : Path.alternation(l, r);
        } else if (expr instanceof Join) {
            Join j = (Join) expr;
            Set<String> shared = endpoints(j.getLeftArg());
            shared.retainAll(endpoints(j.getRightArg()));
            shared.remove(start);
            shared.remove(end);
            for (String mid : shared) {
                Path first = toPath(j.getLeftArg(), start, mid);
                Path second = toPath(j.getRightArg(), mid, end);
                if (null != first && null != second) {
                    return Path.sequence(first, second);
                }
                first = toPath(j.getRightArg(), start, mid);
                second = toPath(j.getLeftArg(), mid, end);
                if (null != first && null != second) {
                    return Path.sequence(first, second);
                }
            }
            return null;
        } else if (expr instanceof Distinct) {
            return toPath(((Distinct) expr).getArg(), start, end);
        } else if (expr instanceof Projection) {
            return toPath(((Projection) expr).getArg(), start, end);
        } else {
            return null;
        }
    }

    private boolean connects(final Var s, final Var o, final String start, final String end) {
        return (s.getName().equals(start) && o.getName().equals(end))
                || (s.getName().equals(end) && o.getName().equals(start));
    }

    private Set<String> endpoints(final TupleExpr expr) {
        Set<String> names = new LinkedHashSet<>();
        for (StatementPattern sp : StatementPatternCollector.process(expr)) {
            names.add(sp.getSubjectVar().getName());
            names.add(sp.getObjectVar().getName());
        }
        return names;
    }

    private List<TemplateTriple> toTemplate(final TupleExpr expr, final IRI defaultTarget) {
        List<TemplateTriple> template = new LinkedList<>();
        if (null == expr) {
            return template;
        }

        VariableOrConstant<String, Value> target = null == defaultTarget
                ? null : VariableOrConstant.<String, Value>constant(defaultTarget);
        for (StatementPattern sp : StatementPatternCollector.process(expr)) {
            Var c = sp.getContextVar();
            template.add(new TemplateTriple(
                    toTemplateTerm(sp.getSubjectVar()),
                    toTemplateTerm(sp.getPredicateVar()),
                    toTemplateTerm(sp.getObjectVar()),
                    null == c ? target : toTemplateTerm(c)));
        }
        return template;
    }

    // blank nodes in a template arrive as anonymous variables, and become labels
    private VariableOrConstant<String, Value> toTemplateTerm(final Var v) {
        if (v.hasValue()) {
            return VariableOrConstant.constant(v.getValue());
        } else if (v.isAnonymous()) {
            BNode label = valueFactory.createBNode(v.getName());
            return VariableOrConstant.<String, Value>constant(label);
        } else {
            return VariableOrConstant.variable(v.getName());
        }
    }

    private VariableOrConstant<String, Value> templateTerm(final String source, final Map<String, Value> constants) {
        Value constant = constants.get(source);
        return null == constant
                ? VariableOrConstant.<String, Value>variable(source)
                : VariableOrConstant.<String, Value>constant(constant);
    }

    private VariableOrConstant<String, Value> toNative(final Var v) {
        return v.hasValue()
                ? new VariableOrConstant<String, Value>(null, v.getValue())
                : new VariableOrConstant<String, Value>(v.getName(), null);
    }

    private GraphScope toScope(final StatementPattern.Scope scope, final Var contextVar) {
        if (null != contextVar) {
            return GraphScope.named(toNative(contextVar));
        } else if (StatementPattern.Scope.NAMED_CONTEXTS == scope) {
            throw new IllegalStateException("named graph scope without a graph variable");
        } else if (null != defaultGraph) {
            return GraphScope.named(VariableOrConstant.<String, Value>constant(defaultGraph));
        } else {
            return GraphScope.DEFAULT;
        }
    }

    private Pattern singleton(final Pattern p) {
        return new BasicGraphPattern(Collections.singletonList(p));
    }

    private List<String> findProjectedNames(final TupleExpr expr) {
        TupleExpr e = expr;
        while (true) {
            if (e instanceof QueryRoot) {
                e = ((QueryRoot) e).getArg();
            } else if (e instanceof Slice) {
                e = ((Slice) e).getArg();
            } else if (e instanceof Distinct) {
                e = ((Distinct) e).getArg();
            } else if (e instanceof Reduced) {
                e = ((Reduced) e).getArg();
            } else if (e instanceof Order) {
                e = ((Order) e).getArg();
            } else if (e instanceof Projection) {
                List<String> names = new LinkedList<>();
                for (ProjectionElem pe : ((Projection) e).getProjectionElemList().getElements()) {
                    names.add(pe.getTargetName());
                }
                return names;
            } else {
                return null;
            }
        }
    }
}
