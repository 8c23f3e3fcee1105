package org.h2ox.api.warehouse;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

@Component
public class JdbcWarehouseClient implements WarehouseClient {
  private static final Logger log = LoggerFactory.getLogger(JdbcWarehouseClient.class);

  private final NamedParameterJdbcTemplate jdbc;

  public JdbcWarehouseClient(DataSource dataSource,
      @Value("${warehouse.query-timeout:30s}") Duration queryTimeout) {
    JdbcTemplate template = new JdbcTemplate(dataSource);
    template.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
    this.jdbc = new NamedParameterJdbcTemplate(template);
  }

  @Override
  public List<WarehouseRow> query(WarehouseQuery query, Map<String, ?> parameters) {
    query.checkParameters(parameters.keySet());
    long startTime = System.currentTimeMillis();
    try {
      List<WarehouseRow> rows = jdbc.query(query.sql(), new MapSqlParameterSource(parameters),
          (rs, rowNum) -> toRow(rs));
      log.debug("Warehouse query {} {} returned {} rows in {} ms", query.queryName(), parameters,
          rows.size(), System.currentTimeMillis() - startTime);
      return rows;
    } catch (DataAccessException ex) {
      throw new QueryException(query.queryName(), "Warehouse query failed", ex);
    }
  }

  private static WarehouseRow toRow(ResultSet rs) throws SQLException {
    ResultSetMetaData meta = rs.getMetaData();
    int columns = meta.getColumnCount();
    List<Object> values = new ArrayList<>(columns);
    for (int i = 1; i <= columns; i++) {
      values.add(toScalar(rs.getObject(i)));
    }
    return new WarehouseRow(values);
  }

  private static Object toScalar(Object value) throws SQLException {
    if (value instanceof java.sql.Date date) {
      return date.toLocalDate();
    }
    if (value instanceof Timestamp timestamp) {
      return timestamp.toInstant();
    }
    if (value instanceof Array array) {
      try {
        return new ArrayList<>(Arrays.asList((Object[]) array.getArray()));
      } finally {
        array.free();
      }
    }
    return value;
  }
}
