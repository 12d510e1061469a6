package com.libragraph.medvault.core.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.medvault.core.dao.ClassificationTagsArgumentFactory;
import com.libragraph.medvault.core.dao.ClassificationTagsColumnMapper;
import io.agroal.api.AgroalDataSource;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;

@ApplicationScoped
@IfBuildProperty(name = "vault.registry.store", stringValue = "jdbi", enableIfMissing = true)
public class JdbiProducer {

    @Produces
    @Singleton
    public Jdbi jdbi(AgroalDataSource dataSource, ObjectMapper objectMapper) {
        return configure(Jdbi.create(dataSource), objectMapper)
                .installPlugin(new PostgresPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
    }

    /** Installs what the registry DAOs need regardless of the database behind {@code jdbi}. */
    public static Jdbi configure(Jdbi jdbi, ObjectMapper objectMapper) {
        return jdbi.installPlugin(new SqlObjectPlugin())
                .registerArgument(new ClassificationTagsArgumentFactory(objectMapper))
                .registerColumnMapper(new ClassificationTagsColumnMapper(objectMapper));
    }
}
