package com.spot.dataset.sql;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.spot.facet.CategorialRule;
import com.spot.facet.CategorialTransform;
import com.spot.facet.Facet;
import com.spot.facet.FacetType;
import com.spot.facet.FacetValues;
import com.spot.facet.Misval;
import com.spot.filter.Aggregate;
import com.spot.filter.AggregateAccumulator;
import com.spot.filter.Filter;
import com.spot.filter.ResultRows;
import com.spot.partition.Group;
import com.spot.partition.Partition;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.jooq.CaseConditionStep;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.DatePart;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Record1;
import org.jooq.Record2;
import org.jooq.ResultQuery;
import org.jooq.SelectConditionStep;
import org.jooq.SelectField;
import org.jooq.Table;
import org.jooq.conf.ParamType;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles filters into relational group-by queries that bucket records exactly like the in-memory
 * backend: continuous partitions test raw values against each group's raw bounds, categorial
 * partitions match literal rules before wildcard rules, and missing values are excluded by the
 * WHERE clause.
 */
public class SqlQueryCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(SqlQueryCompiler.class);

  public static final char LIKE_ESCAPE = '!';

  private final DSLContext dsl;
  private final Table<Record> table;

  public SqlQueryCompiler(DSLContext dsl, String tableName) {
    this.dsl = dsl;
    this.table = DSL.table(DSL.name(tableName));
  }

  public Table<Record> getTable() {
    return table;
  }

  /** Numeric value for continuous-like facets (seconds for time facets), text otherwise. */
  public Field<?> valueField(Facet facet) {
    Field<Object> column = DSL.field(DSL.name(facet.getAccessor()));
    if (facet.getType().isTime()) {
      return DSL.extract(column, DatePart.EPOCH).cast(SQLDataType.DOUBLE);
    }
    if (facet.getType() == FacetType.CONTINUOUS) {
      return column.cast(SQLDataType.DOUBLE);
    }
    return column.cast(SQLDataType.VARCHAR);
  }

  @SuppressWarnings("unchecked")
  private Field<Double> numericField(Facet facet) {
    return (Field<Double>) valueField(facet);
  }

  @SuppressWarnings("unchecked")
  private Field<String> textField(Facet facet) {
    return (Field<String>) valueField(facet);
  }

  /** True when the facet's value is neither null nor one of its missing sentinels. */
  public Condition valid(Facet facet) {
    Condition condition = DSL.field(DSL.name(facet.getAccessor())).isNotNull();
    if (facet.getType().isContinuousLike()) {
      Field<Double> value = numericField(facet);
      for (String sentinel : facet.getMisval()) {
        Double number = FacetValues.numericValue(facet, sentinel);
        if (number != null) {
          condition = condition.and(value.ne(DSL.inline(number)));
        }
      }
    } else if (facet.getType() == FacetType.CATEGORIAL) {
      Field<String> value = textField(facet);
      for (String sentinel : facet.getMisval()) {
        condition = condition.and(value.ne(DSL.inline(sentinel)));
      }
    }
    return condition;
  }

  /** Multi-branch conditional giving a record's bucket index, 0 when no group matches. */
  public Field<Integer> bucketExpression(Partition partition, Facet facet) {
    if (facet == null) {
      return DSL.inline(Group.OTHER_INDEX);
    }
    CaseConditionStep<Integer> expression = null;
    if (partition.isContinuous()) {
      Field<Double> value = numericField(facet);
      for (Group group : partition.getGroups()) {
        Condition lower =
            group.index() == 1
                ? value.ge(DSL.inline(group.rawMin()))
                : value.gt(DSL.inline(group.rawMin()));
        Condition inGroup = lower.and(value.le(DSL.inline(group.rawMax())));
        expression = when(expression, inGroup, group.index());
      }
    } else {
      Field<String> value = textField(facet);
      CategorialTransform transform = facet.getCategorialTransform();
      if (!transform.isActive()) {
        for (Group group : partition.getGroups()) {
          expression = when(expression, value.eq(DSL.inline(group.label())), group.index());
        }
      } else {
        for (CategorialRule rule : transform.getRules()) {
          if (!rule.isWildcard()) {
            Condition matches = value.eq(DSL.inline(rule.expression()));
            expression = when(expression, matches, partition.indexOfLabel(rule.group()));
          }
        }
        for (CategorialRule rule : transform.getRules()) {
          if (rule.isWildcard()) {
            Condition matches =
                value.like(DSL.inline(escapeLike(rule.expression()))).escape(LIKE_ESCAPE);
            expression = when(expression, matches, partition.indexOfLabel(rule.group()));
          }
        }
      }
    }
    if (expression == null) {
      return DSL.inline(Group.OTHER_INDEX);
    }
    return expression.otherwise(DSL.inline(Group.OTHER_INDEX));
  }

  private static CaseConditionStep<Integer> when(
      CaseConditionStep<Integer> expression, Condition condition, int bucket) {
    return expression == null
        ? DSL.when(condition, DSL.inline(bucket))
        : expression.when(condition, DSL.inline(bucket));
  }

  /** Escapes LIKE metacharacters except {@code %}, which stays the only wildcard. */
  static String escapeLike(String expression) {
    StringBuilder escaped = new StringBuilder(expression.length() + 4);
    for (char c : expression.toCharArray()) {
      if (c == LIKE_ESCAPE || c == '_') {
        escaped.append(LIKE_ESCAPE);
      }
      escaped.append(c);
    }
    return escaped.toString();
  }

  /**
   * The restriction another filter's selection puts on this query: the records must be valid for
   * all of its partitions and fall into a selected bucket of every partition with a selection.
   */
  public Condition selectionCondition(Filter filter, Function<String, Facet> facets) {
    if (!filter.hasSelection()) {
      return DSL.noCondition();
    }
    Condition condition = DSL.noCondition();
    for (Partition partition : filter.getPartitions()) {
      Facet facet = facets.apply(partition.getFacetId());
      if (facet != null) {
        condition = condition.and(valid(facet));
      }
      if (partition.hasSelection()) {
        ImmutableSet<Integer> buckets = partition.selectedBuckets();
        if (buckets.isEmpty()) {
          condition = condition.and(DSL.falseCondition());
        } else {
          List<Field<Integer>> inlined = new ArrayList<>();
          buckets.forEach(bucket -> inlined.add(DSL.inline(bucket)));
          condition = condition.and(bucketExpression(partition, facet).in(inlined));
        }
      }
    }
    return condition;
  }

  public CompiledQuery compile(
      Filter filter, Function<String, Facet> facets, List<Filter> otherFilters) {
    ImmutableList<Partition> partitions = filter.getPartitions();
    ImmutableList<Aggregate> aggregates = filter.getEffectiveAggregates();

    List<SelectField<?>> select = new ArrayList<>();
    List<Field<Integer>> buckets = new ArrayList<>();
    Condition where = DSL.noCondition();
    for (Partition partition : partitions) {
      Facet facet = facets.apply(partition.getFacetId());
      Field<Integer> bucket = bucketExpression(partition, facet);
      buckets.add(bucket);
      select.add(bucket);
      if (facet != null) {
        where = where.and(valid(facet));
      }
    }

    List<AggregateColumns> columns = new ArrayList<>();
    for (Aggregate aggregate : aggregates) {
      Facet facet = facets.apply(aggregate.facetId());
      if (aggregate.isRowCount()) {
        columns.add(new AggregateColumns(aggregate, select.size(), -1, true, true));
        select.add(DSL.count());
      } else if (facet == null) {
        LOG.warn("Aggregate refers to unknown facet {}", aggregate.facetId());
        columns.add(new AggregateColumns(aggregate, -1, -1, false, false));
      } else if (facet.getType().isContinuousLike()) {
        Field<Double> value = DSL.when(valid(facet), numericField(facet));
        columns.add(new AggregateColumns(aggregate, select.size(), select.size() + 1, true, false));
        select.add(DSL.count(value));
        select.add(DSL.sum(value));
      } else {
        Field<String> value = DSL.when(valid(facet), textField(facet));
        columns.add(new AggregateColumns(aggregate, select.size(), -1, false, false));
        select.add(DSL.count(value));
      }
    }

    for (Filter other : otherFilters) {
      where = where.and(selectionCondition(other, facets));
    }

    SelectConditionStep<Record> grouped = dsl.select(select).from(table).where(where);
    ResultQuery<Record> query =
        buckets.isEmpty()
            ? grouped.having(DSL.count().gt(0))
            : grouped.groupBy(buckets).orderBy(buckets.stream().map(Field::asc).toList());
    return new CompiledQuery(query, partitions, ImmutableList.copyOf(columns));
  }

  /** Query counting records that pass the selections of the given filters. */
  public ResultQuery<Record1<Integer>> countQuery(
      List<Filter> filters, Function<String, Facet> facets) {
    Condition where = DSL.noCondition();
    for (Filter filter : filters) {
      where = where.and(selectionCondition(filter, facets));
    }
    return dsl.select(DSL.count()).from(table).where(where);
  }

  public ResultQuery<Record2<Double, Double>> minMaxQuery(Facet facet) {
    Field<Double> value = numericField(facet);
    return dsl.select(DSL.min(value), DSL.max(value)).from(table).where(valid(facet));
  }

  /** Every valid value of a continuous-like facet in ascending order. */
  public ResultQuery<Record1<Double>> sortedValuesQuery(Facet facet) {
    Field<Double> value = numericField(facet);
    return dsl.select(value).from(table).where(valid(facet)).orderBy(value.asc());
  }

  /** The most frequent values of a facet with their counts, most frequent first. */
  public ResultQuery<Record2<String, Integer>> categoriesQuery(Facet facet, int limit) {
    Field<String> value = textField(facet);
    return dsl.select(value, DSL.count())
        .from(table)
        .where(valid(facet))
        .groupBy(value)
        .orderBy(DSL.count().desc(), value.asc())
        .limit(limit);
  }

  public ResultQuery<Record> sampleQuery(int limit) {
    return dsl.selectDistinct(DSL.asterisk()).from(table).limit(limit);
  }

  /** Positions of one aggregate's columns in the compiled select list; -1 when absent. */
  record AggregateColumns(
      Aggregate aggregate, int countColumn, int sumColumn, boolean numeric, boolean rowCount) {

    AggregateAccumulator accumulator(Record record) {
      long count = countColumn < 0 ? 0 : record.get(countColumn, Long.class);
      if (rowCount) {
        return new AggregateAccumulator(count, count, BigDecimal.valueOf(count));
      }
      BigDecimal sum = sumColumn < 0 ? null : record.get(sumColumn, BigDecimal.class);
      return new AggregateAccumulator(count, numeric ? count : 0, sum);
    }

    Object reduce(Record record) {
      if (countColumn < 0) {
        return Misval.MISSING;
      }
      return aggregate.operation().reduce(accumulator(record));
    }
  }

  /** A compiled filter query and the state needed to relabel its rows. */
  public static final class CompiledQuery {
    private final ResultQuery<Record> query;
    private final ImmutableList<Partition> partitions;
    private final ImmutableList<ImmutableList<String>> labels;
    private final ImmutableList<AggregateColumns> columns;

    CompiledQuery(
        ResultQuery<Record> query,
        ImmutableList<Partition> partitions,
        ImmutableList<AggregateColumns> columns) {
      this.query = query;
      this.partitions = partitions;
      this.columns = columns;
      ImmutableList.Builder<ImmutableList<String>> builder = ImmutableList.builder();
      for (Partition partition : partitions) {
        ImmutableList.Builder<String> partitionLabels = ImmutableList.builder();
        partitionLabels.add(Group.OTHER_LABEL);
        partition.getGroups().forEach(group -> partitionLabels.add(group.label()));
        builder.add(partitionLabels.build());
      }
      this.labels = builder.build();
    }

    public ResultQuery<Record> getQuery() {
      return query;
    }

    public String getSql() {
      return query.getSQL(ParamType.INLINED);
    }

    /** Runs the query and relabels bucket indices to group labels. */
    public List<ImmutableMap<String, Object>> fetchRows() {
      List<ImmutableMap<String, Object>> rows = new ArrayList<>();
      for (Record record : query.fetch()) {
        List<String> rowLabels = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
          rowLabels.add(label(i, record.get(i, Integer.class)));
        }
        List<Object> values = new ArrayList<>(columns.size());
        columns.forEach(column -> values.add(column.reduce(record)));
        rows.add(ResultRows.row(rowLabels, values));
      }
      return rows;
    }

    private String label(int partition, Integer bucket) {
      ImmutableList<String> partitionLabels = labels.get(partition);
      int index = bucket == null ? Group.OTHER_INDEX : bucket;
      if (index >= partitionLabels.size()) {
        LOG.warn(
            "Bucket {} beyond the {} groups of partition {}, using the last group",
            index,
            partitionLabels.size() - 1,
            partitions.get(partition).getFacetId());
        index = partitionLabels.size() - 1;
      } else if (index < Group.OTHER_INDEX) {
        index = Group.OTHER_INDEX;
      }
      return partitionLabels.get(index);
    }
  }
}
