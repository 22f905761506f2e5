package io.github.kirc.api.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.kirc.core.pipeline.OptLevel;
import io.github.kirc.core.pipeline.PipelineConfig;
import io.github.kirc.core.regalloc.TargetDesc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Reads a {@link CompilerConfig} from the {@code kirc} section of a Typesafe config.
 * <p>
 * Defaults come from {@code reference.conf}, and can be overridden by {@code application.conf}
 * or by system properties such as {@code -Dkirc.opt-level=none}.
 */
public final class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String ROOT = "kirc";

    private ConfigLoader() {
    }

    /**
     * Load the configuration from the classpath and system properties.
     *
     * @return The configuration.
     */
    public static CompilerConfig load() {
        return load(ConfigFactory.load());
    }

    /**
     * Read the configuration from a config, falling back to the defaults of {@code reference.conf}
     * for anything it leaves out.
     *
     * @param config The config, with a {@code kirc} section.
     * @return The configuration.
     * @throws ConfigException If a setting is missing or has the wrong type.
     */
    public static CompilerConfig load(Config config) {
        Config kirc = config
                .withFallback(ConfigFactory.defaultReference(ConfigLoader.class.getClassLoader()))
                .resolve()
                .getConfig(ROOT);

        String level = kirc.getString("opt-level");
        OptLevel optLevel;
        try {
            optLevel = OptLevel.valueOf(level.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigException.BadValue(kirc.origin(), "opt-level", "unknown optimization level " + level, e);
        }
        int maxRounds = kirc.hasPath("max-rounds") ? kirc.getInt("max-rounds") : optLevel.rounds;
        PipelineConfig pipeline = PipelineConfig.builder()
                .optLevel(optLevel)
                .maxRounds(maxRounds)
                .verify(kirc.getBoolean("verify"))
                .inlineThreshold(kirc.getInt("inline-threshold"))
                .inlineDepth(kirc.getInt("inline-depth"))
                .unrollTripCap(kirc.getInt("unroll.trip-cap"))
                .unrollSizeCap(kirc.getInt("unroll.size-cap"))
                .build();

        CompilerConfig loaded = new CompilerConfig(
                pipeline,
                kirc.getInt("workers"),
                target(kirc.getConfig("target")),
                kirc.getStringList("backends"),
                kirc.getString("jvm.class-name"));
        LOGGER.debug("loaded {}", loaded);
        return loaded;
    }

    private static TargetDesc target(Config target) {
        if (target.hasPath("int-registers") || target.hasPath("float-registers")) {
            return TargetDesc.withCounts(
                    target.getInt("int-registers"),
                    target.getInt("float-registers"),
                    target.getInt("scratch-registers"));
        }
        String preset = target.getString("preset");
        if (!"x86_64".equals(preset)) {
            throw new ConfigException.BadValue(target.origin(), "preset", "unknown target " + preset);
        }
        return TargetDesc.x86_64();
    }
}
