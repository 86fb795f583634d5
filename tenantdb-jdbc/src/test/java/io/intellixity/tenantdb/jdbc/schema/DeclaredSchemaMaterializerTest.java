package io.intellixity.tenantdb.jdbc.schema;

import io.intellixity.tenantdb.engine.EngineKey;
import io.intellixity.tenantdb.jdbc.JdbcEngineHandle;
import io.intellixity.tenantdb.jdbc.UnpooledDataSource;
import io.intellixity.tenantdb.schema.SchemaException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class DeclaredSchemaMaterializerTest {
  private JdbcEngineHandle engine;

  @BeforeEach
  void setUp() {
    String url = "jdbc:h2:mem:schema_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
    Properties p = new Properties();
    p.setProperty("user", "sa");
    p.setProperty("password", "");
    engine = new JdbcEngineHandle("schema-test", new UnpooledDataSource(url, p), new EngineKey("billing", "h2:0"), url);
  }

  @AfterEach
  void tearDown() {
    engine.close();
  }

  @Test
  void createsDeclaredTablesInOrder() throws Exception {
    DeclaredSchemaMaterializer m = new DeclaredSchemaMaterializer()
        .declare("billing",
            TableDeclaration.of("accounts", "CREATE TABLE accounts(id INT PRIMARY KEY)"),
            TableDeclaration.of("invoices", "CREATE TABLE invoices(id INT PRIMARY KEY, account_id INT REFERENCES accounts(id))"));
    m.materialize(engine, "billing");
    assertEquals(List.of("ACCOUNTS", "INVOICES"), tables());
  }

  @Test
  void secondRunIsANoOp() throws Exception {
    DeclaredSchemaMaterializer m = new DeclaredSchemaMaterializer()
        .declare("billing", TableDeclaration.of("accounts", "CREATE TABLE accounts(id INT PRIMARY KEY)"));
    m.materialize(engine, "billing");
    m.materialize(engine, "billing");
    assertEquals(List.of("ACCOUNTS"), tables());
  }

  @Test
  void onlyMissingTablesAreCreated() throws Exception {
    try (Connection c = engine.connection(); Statement st = c.createStatement()) {
      st.execute("CREATE TABLE Accounts(id INT PRIMARY KEY, legacy VARCHAR(8))");
    }
    DeclaredSchemaMaterializer m = new DeclaredSchemaMaterializer()
        .declare("billing",
            TableDeclaration.of("accounts", "CREATE TABLE accounts(id INT PRIMARY KEY)"),
            TableDeclaration.of("payments", "CREATE TABLE payments(id INT PRIMARY KEY)"));
    m.materialize(engine, "billing");
    assertEquals(List.of("ACCOUNTS", "PAYMENTS"), tables());
  }

  @Test
  void sameNamedTablesInOtherSchemasDoNotCount() throws Exception {
    try (Connection c = engine.connection(); Statement st = c.createStatement()) {
      st.execute("CREATE SCHEMA audit");
      st.execute("CREATE TABLE audit.visits(id INT PRIMARY KEY)");
    }
    DeclaredSchemaMaterializer m = new DeclaredSchemaMaterializer()
        .declare("billing",
            TableDeclaration.of("visits", "CREATE TABLE visits(id INT PRIMARY KEY)"),
            TableDeclaration.of("users", "CREATE TABLE users(id INT PRIMARY KEY)"));
    m.materialize(engine, "billing");
    assertEquals(List.of("USERS", "VISITS"), tables());
  }

  @Test
  void schemaNamesAreEscapedForPatterns() {
    assertEquals("tenant\\_a", DeclaredSchemaMaterializer.escape("tenant_a", "\\"));
    assertEquals("50\\%", DeclaredSchemaMaterializer.escape("50%", "\\"));
    assertEquals("tenant_a", DeclaredSchemaMaterializer.escape("tenant_a", ""));
  }

  @Test
  void undeclaredDatabaseDoesNothing() throws Exception {
    new DeclaredSchemaMaterializer().materialize(engine, "billing");
    assertEquals(List.of(), tables());
  }

  @Test
  void ddlFailureIsSchemaException() {
    DeclaredSchemaMaterializer m = new DeclaredSchemaMaterializer()
        .declare("billing", TableDeclaration.of("broken", "CREATE TABLE broken (id NOT_A_TYPE)"));
    SchemaException e = assertThrows(SchemaException.class, () -> m.materialize(engine, "billing"));
    assertNotNull(e.getCause());
  }

  @Test
  void declarationsAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> TableDeclaration.of(" ", "CREATE TABLE x(id INT)"));
    assertThrows(IllegalArgumentException.class, () -> new DeclaredSchemaMaterializer().declare(""));
  }

  private List<String> tables() throws Exception {
    List<String> out = new ArrayList<>();
    try (Connection c = engine.connection();
         Statement st = c.createStatement();
         ResultSet rs = st.executeQuery(
             "SELECT table_name FROM information_schema.tables WHERE table_schema = 'PUBLIC' ORDER BY table_name")) {
      while (rs.next()) out.add(rs.getString(1));
    }
    return out;
  }
}
