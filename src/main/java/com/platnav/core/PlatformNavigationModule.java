package com.platnav.core;

import com.google.inject.AbstractModule;
import com.platnav.config.PlatformGraphConfig;
import com.platnav.config.PlatformGraphConfigLoader;
import com.platnav.geometry.ShapeQueryProvider;
import com.platnav.navigation.PlatformGraphGenerator;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Guice module for platform navigation.
 *
 * <p>Binds the configuration and the physics backend. {@link PlatformGraphGenerator} is
 * {@code @Singleton} annotated on the class itself, so every injection point shares one graph.
 */
@Slf4j
public class PlatformNavigationModule extends AbstractModule {

    private final PlatformGraphConfig config;
    private final ShapeQueryProvider shapeQueryProvider;

    public PlatformNavigationModule(PlatformGraphConfig config, ShapeQueryProvider shapeQueryProvider) {
        this.config = config.validate();
        this.shapeQueryProvider = shapeQueryProvider;
    }

    /**
     * Create a module using the bundled configuration resource.
     *
     * @throws IOException if the bundled configuration cannot be read
     */
    public static PlatformNavigationModule withDefaultConfig(ShapeQueryProvider shapeQueryProvider)
            throws IOException {
        return new PlatformNavigationModule(PlatformGraphConfigLoader.loadFromResources(), shapeQueryProvider);
    }

    @Override
    protected void configure() {
        bind(PlatformGraphConfig.class).toInstance(config);
        bind(ShapeQueryProvider.class).toInstance(shapeQueryProvider);
        log.debug("Platform navigation bound to {}", shapeQueryProvider.getClass().getSimpleName());
    }
}
