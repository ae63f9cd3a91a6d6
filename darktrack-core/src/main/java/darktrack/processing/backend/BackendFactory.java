/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of DarkTrack
 *
 * DarkTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DarkTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DarkTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package darktrack.processing.backend;

import darktrack.configuration.AccelerationMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Selects the numeric backend once per run
 * @author Jean Ollion
 */
public class BackendFactory {
    public final static Logger logger = LoggerFactory.getLogger(BackendFactory.class);

    public static NumericBackend getDefaultBackend() {
        return new JTransformsBackend();
    }

    /**
     * OFF: default backend. ON / AUTO: first accelerated backend that can be created, default backend otherwise.
     * Unavailability is never an error.
     * @param mode acceleration mode
     * @return backend
     */
    public static NumericBackend getBackend(AccelerationMode mode) {
        if (mode==null || AccelerationMode.OFF.equals(mode)) return getDefaultBackend();
        try {
            for (NumericBackendProvider provider : ServiceLoader.load(NumericBackendProvider.class)) {
                if (!provider.isAvailable()) {
                    logger.debug("accelerated backend: {} not available", provider.getName());
                    continue;
                }
                try {
                    NumericBackend backend = provider.create();
                    logger.info("using accelerated backend: {}", backend.getName());
                    return backend;
                } catch (BackendUnavailableException e) {
                    logger.debug("accelerated backend: {} could not be created", provider.getName(), e);
                }
            }
        } catch (ServiceConfigurationError e) {
            logger.debug("error while loading accelerated backends", e);
        }
        if (AccelerationMode.ON.equals(mode)) logger.info("acceleration requested but no accelerated backend is available: falling back to {}", JTransformsBackend.NAME);
        else logger.debug("no accelerated backend: using {}", JTransformsBackend.NAME);
        return getDefaultBackend();
    }
}
