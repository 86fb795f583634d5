package io.intellixity.tenantdb.examples.config;

import io.intellixity.tenantdb.config.ConnectionDescriptor;
import io.intellixity.tenantdb.engine.EngineKey;
import io.intellixity.tenantdb.hook.AutoHook;
import io.intellixity.tenantdb.hook.HookRegistry;
import io.intellixity.tenantdb.jdbc.JdbcSessionManager;
import io.intellixity.tenantdb.jdbc.postgres.PostgresEngines;
import io.intellixity.tenantdb.jdbc.postgres.PostgresEnvironment;
import io.intellixity.tenantdb.jdbc.schema.DeclaredSchemaMaterializer;
import io.intellixity.tenantdb.jdbc.schema.TableDeclaration;
import io.intellixity.tenantdb.session.LifecycleListener;
import io.intellixity.tenantdb.session.LifecycleState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(TenantDbProperties.class)
public class TenantDbExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(TenantDbExampleConfig.class);

  static final String VISITS_DDL = """
      CREATE TABLE visits (
        id BIGSERIAL PRIMARY KEY,
        path VARCHAR(512) NOT NULL,
        visited_at TIMESTAMPTZ NOT NULL DEFAULT now()
      )""";

  @Bean
  public ConnectionDescriptor connectionDescriptor(TenantDbProperties props) {
    Map<String, String> env = new HashMap<>();
    env.putAll(props.getEnv());
    if (props.isUseSystemEnv()) env.putAll(System.getenv());
    return PostgresEnvironment.load(env);
  }

  @Bean
  public DeclaredSchemaMaterializer schemaMaterializer(TenantDbProperties props) {
    return new DeclaredSchemaMaterializer()
        .declare(props.getDatabase(), TableDeclaration.of("visits", VISITS_DDL));
  }

  @Bean(destroyMethod = "close")
  public JdbcSessionManager sessionManager(ConnectionDescriptor descriptor,
                                           DeclaredSchemaMaterializer materializer,
                                           TenantDbProperties props) {
    LifecycleListener listener = new LifecycleListener() {
      @Override
      public void onTransition(EngineKey key, LifecycleState state) {
        if (state == LifecycleState.POSTCREATED) log.info("examples.tenantdb op=ready db={}", key.resolvedDatabase());
      }

      @Override
      public void onFailure(EngineKey key, LifecycleState failedIn, Throwable error) {
        log.warn("examples.tenantdb op=failed db={} state={} error={}", key.resolvedDatabase(), failedIn, error.toString());
      }
    };
    JdbcSessionManager manager = new JdbcSessionManager(
        descriptor, HookRegistry.blocking(), materializer, PostgresEngines.factory(), listener);

    String db = props.getDatabase();
    manager.registerPrecreate(db, AutoHook.of("CREATE EXTENSION IF NOT EXISTS pgcrypto"));
    manager.registerPostcreate(db, AutoHook.of(
        "CREATE INDEX IF NOT EXISTS visits_visited_at_idx ON visits (visited_at)",
        "CREATE TABLE IF NOT EXISTS visit_audit (id UUID PRIMARY KEY DEFAULT gen_random_uuid(), "
            + "tenant_id VARCHAR(128), note VARCHAR(512) NOT NULL, created_at TIMESTAMPTZ NOT NULL DEFAULT now())"));
    manager.registerPostcreateManual(db, (session, tenantId) -> session.execute(
        "INSERT INTO visit_audit (tenant_id, note) VALUES (?, ?)", tenantId, "provisioned"));
    return manager;
  }
}
