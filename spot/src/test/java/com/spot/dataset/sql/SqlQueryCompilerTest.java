package com.spot.dataset.sql;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.spot.facet.CategorialRule;
import com.spot.facet.Facet;
import com.spot.facet.FacetType;
import com.spot.facet.Misval;
import com.spot.filter.Aggregate;
import com.spot.filter.AggregateOperation;
import com.spot.partition.GroupingStrategy;
import com.spot.partition.Partition;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.List;
import org.jooq.QueryPart;
import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SqlQueryCompilerTest {
  private SqlQueryCompiler compiler;

  @BeforeEach
  public void setUp() {
    compiler = new SqlQueryCompiler(DSL.using(SQLDialect.H2), "records");
  }

  private static String render(QueryPart part) {
    return DSL.using(SQLDialect.H2).renderInlined(part);
  }

  @Test
  public void testContinuousBucketExpression() {
    Facet mpg = new Facet("mpg", FacetType.CONTINUOUS);
    mpg.setDomain(0.0, 10.0);
    Partition partition = new Partition("mpg", GroupingStrategy.FIXED_N, 2);
    partition.reset(mpg);
    partition.setGroups(mpg);

    String sql = render(compiler.bucketExpression(partition, mpg));

    assertThat(sql).containsIgnoringCase("case when").containsIgnoringCase("else 0");
    assertThat(sql.toLowerCase()).containsOnlyOnce(" then 1").containsOnlyOnce(" then 2");
    assertThat(sql).contains(">=").contains("<=").contains("\"mpg\"");
  }

  @Test
  public void testCategorialRulesPutLiteralsFirst() {
    Facet origin = new Facet("origin", FacetType.CATEGORIAL);
    origin.getCategorialTransform().addRule(new CategorialRule("E_%", "Europe", 2));
    origin.getCategorialTransform().addRule(new CategorialRule("US", "America", 3));
    Partition partition = new Partition("origin");
    partition.reset(origin);
    partition.setGroups(origin);

    String sql = render(compiler.bucketExpression(partition, origin));

    assertThat(sql).contains("'US'").contains("'E!_%'");
    assertThat(sql.indexOf("'US'")).isLessThan(sql.indexOf("'E!_%'"));
    assertThat(sql).containsIgnoringCase("like").containsIgnoringCase("escape '!'");
  }

  @Test
  public void testMissingFacetLandsInOtherBucket() {
    assertThat(render(compiler.bucketExpression(new Partition("gone"), null))).isEqualTo("0");
  }

  @Test
  public void testValidExcludesSentinels() {
    Facet mpg = new Facet("mpg", FacetType.CONTINUOUS);
    mpg.setMisval(List.of("-999", "n/a"));
    Facet origin = new Facet("origin", FacetType.CATEGORIAL);
    origin.setMisval(List.of("unknown"));

    String numeric = render(compiler.valid(mpg));
    assertThat(numeric).containsIgnoringCase("is not null").contains("<>");
    assertThat(numeric).doesNotContain("n/a");
    assertThat(render(compiler.valid(origin))).contains("'unknown'");
  }

  @Test
  public void testValidExcludesTimeSentinelsBySeconds() {
    Facet released = new Facet("released", FacetType.DATETIME);
    released.setMisval(List.of("1970-01-01T00:00:00Z", "never"));
    Facet lap = new Facet("lap", FacetType.DURATION);
    lap.setMisval(List.of("PT1M"));

    String datetime = render(compiler.valid(released));
    assertThat(datetime.split("<>", -1)).hasSize(2);
    assertThat(datetime).contains("\"released\"").doesNotContain("never").doesNotContain("1970");
    assertThat(render(compiler.valid(lap))).contains("<>").doesNotContain("PT1M");
  }

  @Test
  public void testColumnFacetTypes() {
    assertThat(SqlDataset.facetType(SQLDataType.INTEGER)).isEqualTo(FacetType.CONTINUOUS);
    assertThat(SqlDataset.facetType(SQLDataType.VARCHAR)).isEqualTo(FacetType.CATEGORIAL);
    assertThat(SqlDataset.facetType(SQLDataType.TIMESTAMPWITHTIMEZONE))
        .isEqualTo(FacetType.DATETIME);
    assertThat(SqlDataset.facetType(SQLDataType.OTHER)).isNull();
    assertThat(SqlDataset.facetType(SQLDataType.BLOB)).isNull();
  }

  @Test
  public void testEscapeLike() {
    assertThat(SqlQueryCompiler.escapeLike("a_b!c%")).isEqualTo("a!_b!!c%");
    assertThat(SqlQueryCompiler.escapeLike("plain")).isEqualTo("plain");
  }

  @Test
  public void testRelabelsBucketIndices() throws Exception {
    Facet origin = new Facet("origin", FacetType.CATEGORIAL);
    origin.getCategorialTransform().addRule(new CategorialRule("US", "US", 1));
    origin.getCategorialTransform().addRule(new CategorialRule("EU", "EU", 1));
    Partition partition = new Partition("origin");
    partition.reset(origin);
    partition.setGroups(origin);

    try (Connection connection = DriverManager.getConnection("jdbc:h2:mem:relabel")) {
      SqlQueryCompiler.AggregateColumns rowCount =
          new SqlQueryCompiler.AggregateColumns(Aggregate.rowCount(), 1, -1, true, true);
      SqlQueryCompiler.AggregateColumns sum =
          new SqlQueryCompiler.AggregateColumns(
              new Aggregate("mpg", AggregateOperation.SUM), 2, 3, true, false);
      SqlQueryCompiler.CompiledQuery query =
          new SqlQueryCompiler.CompiledQuery(
              DSL.using(connection, SQLDialect.H2)
                  .resultQuery(
                      "select * from (values (0, 3, 0, null), (2, 4, 2, 9.5), (7, 1, 1, 2))"
                          + " order by 1"),
              ImmutableList.of(partition),
              ImmutableList.of(rowCount, sum));

      assertThat(query.fetchRows())
          .containsExactly(
              ImmutableMap.of("a", "Other", "aa", 3.0, "bb", Misval.MISSING),
              ImmutableMap.of("a", "EU", "aa", 4.0, "bb", 9.5),
              ImmutableMap.of("a", "EU", "aa", 1.0, "bb", 2.0));
    }
  }
}
