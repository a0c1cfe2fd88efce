package calculadora;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;
import java.util.Set;

import javax.validation.ConstraintViolation;
import javax.validation.ConstraintViolationException;
import javax.validation.Validation;
import javax.validation.Validator;
import javax.validation.ValidatorFactory;
import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.Positive;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Configuração da calculadora, validada com Hibernate Validator (javax.validation).
 */
public final class CalculatorSettings {

    private static final Logger logger = LogManager.getLogger(CalculatorSettings.class);

    public static final String DEFAULT_RESOURCE = "calculator.properties";
    public static final String EPSILON_KEY = "calculator.epsilon";

    private static final CalculatorSettings DEFAULTS = new CalculatorSettings(MathUtils.DEFAULT_EPSILON);

    @Positive
    @DecimalMax("1")
    private final double epsilon;

    private CalculatorSettings(double epsilon) {
        this.epsilon = epsilon;
    }

    public static CalculatorSettings defaults() {
        return DEFAULTS;
    }

    /**
     * @throws ConstraintViolationException se o epsilon não estiver em (0, 1]
     */
    public static CalculatorSettings of(double epsilon) {
        CalculatorSettings settings = new CalculatorSettings(epsilon);
        validate(settings);
        return settings;
    }

    /**
     * Carrega {@value #DEFAULT_RESOURCE} do classpath.
     */
    public static CalculatorSettings load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Carrega as configurações de um recurso do classpath. Recurso ou chave
     * ausente resulta nos valores padrão.
     *
     * @throws IllegalArgumentException se o valor não for um número
     * @throws ConstraintViolationException se o valor for inválido
     */
    public static CalculatorSettings load(String resource) {
        Properties properties = new Properties();
        try (InputStream in = CalculatorSettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("Recurso {} nao encontrado, usando configuracao padrao", resource);
                return DEFAULTS;
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Falha ao ler " + resource, e);
        }

        String raw = properties.getProperty(EPSILON_KEY);
        if (raw == null || raw.isBlank()) {
            logger.debug("Chave {} ausente em {}, usando epsilon padrao", EPSILON_KEY, resource);
            return DEFAULTS;
        }

        double epsilon;
        try {
            epsilon = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor invalido para " + EPSILON_KEY + ": " + raw, e);
        }

        CalculatorSettings settings = of(epsilon);
        logger.info("Configuracao carregada de {}: epsilon={}", resource, epsilon);
        return settings;
    }

    private static void validate(CalculatorSettings settings) {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            Set<ConstraintViolation<CalculatorSettings>> violacoes = validator.validate(settings);
            if (!violacoes.isEmpty()) {
                for (ConstraintViolation<CalculatorSettings> v : violacoes) {
                    logger.warn("Configuracao invalida - {}: {}", v.getPropertyPath(), v.getMessage());
                }
                throw new ConstraintViolationException(violacoes);
            }
        }
    }

    public double getEpsilon() {
        return epsilon;
    }

    @Override
    public String toString() {
        return "CalculatorSettings[epsilon=" + epsilon + "]";
    }
}
