package czm.staff_application_be.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Reads Docker secret files (database password, bridge token) and exposes them as the
 * highest-precedence property source. The directory defaults to {@code /run/secrets} and can be
 * moved with the {@code SECRETS_DIR} environment property.
 */
public class SecretsPropertySourceEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(SecretsPropertySourceEnvironmentPostProcessor.class);

    static final String PROPERTY_SOURCE_NAME = "secretsPropertySource";
    private static final String SECRETS_DIR_KEY = "SECRETS_DIR";
    private static final Path DEFAULT_SECRETS_DIR = Path.of("/run/secrets");

    private static final List<SecretDescriptor> DEFAULT_SECRETS = List.of(
            new SecretDescriptor("DB_PASSWORD", "staff-application_postgres-password"),
            new SecretDescriptor("BRIDGE_TOKEN", "staff-application_bridge-token"));

    private final List<SecretDescriptor> secretDescriptors;

    public SecretsPropertySourceEnvironmentPostProcessor() {
        this(DEFAULT_SECRETS);
    }

    SecretsPropertySourceEnvironmentPostProcessor(List<SecretDescriptor> secretDescriptors) {
        this.secretDescriptors = secretDescriptors;
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String configuredDir = environment.getProperty(SECRETS_DIR_KEY);
        Path secretsDir = configuredDir != null && !configuredDir.isBlank() ? Path.of(configuredDir) : DEFAULT_SECRETS_DIR;

        Map<String, Object> secrets = new LinkedHashMap<>();
        for (SecretDescriptor descriptor : secretDescriptors) {
            readSecret(secretsDir.resolve(descriptor.fileName()))
                    .ifPresent(value -> secrets.put(descriptor.key(), value));
        }

        if (secrets.isEmpty()) {
            log.info("No secret files found in {}, using environment and application.yml", secretsDir);
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
        log.info("Loaded secrets property source with keys: {}", secrets.keySet());
    }

    private Optional<String> readSecret(Path path) {
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(path).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException exception) {
            log.warn("Failed to read secret from {}", path, exception);
            return Optional.empty();
        }
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    record SecretDescriptor(String key, String fileName) {}
}
