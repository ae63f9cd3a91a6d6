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
package darktrack.configuration;

import darktrack.image.ImageProperties;
import darktrack.utils.JSONSerializable;
import darktrack.utils.JSONUtils;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Geometry and advanced options of a run, serialized as a JSON object whose geometry fields are at the root
 * and advanced options under the key "advanced".
 * @author Jean Ollion
 */
public class DarkTrackConfiguration implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(DarkTrackConfiguration.class);
    final OpticalGeometry geometry;
    final ReconstructionOptions options;

    public DarkTrackConfiguration() {
        this(new OpticalGeometry(), new ReconstructionOptions());
    }

    public DarkTrackConfiguration(OpticalGeometry geometry, ReconstructionOptions options) {
        this.geometry = geometry;
        this.options = options==null ? new ReconstructionOptions() : options;
    }

    public OpticalGeometry getGeometry() {
        return geometry;
    }

    public ReconstructionOptions getOptions() {
        return options;
    }

    /**
     * Checks required fields and consistency with the hologram stack
     * @param holograms hologram stack, Z = frames
     * @throws ConfigurationException if a field is missing or invalid, or the explicit background does not match the stack
     */
    public void validate(ImageProperties holograms) {
        geometry.validate();
        options.validate();
        if (holograms.sizeZ()<1) throw new ConfigurationException("Hologram stack has no frame");
        options.getFrameNumber(holograms.sizeZ());
        BackgroundRemoval bck = options.getBackgroundRemoval();
        if (BackgroundRemoval.Mode.EXPLICIT.equals(bck.getMode())) {
            ImageProperties b = bck.getBackground();
            if (!b.sameDimensions2D(holograms)) throw new ConfigurationException("Background dimensions: "+b.sizeX()+"x"+b.sizeY()+" differ from hologram dimensions: "+holograms.sizeX()+"x"+holograms.sizeY());
            if (b.sizeZ()!=1 && b.sizeZ()!=holograms.sizeZ()) throw new ConfigurationException("3D background should have one plane per frame: "+b.sizeZ()+" planes for "+holograms.sizeZ()+" frames");
        }
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = (JSONObject)geometry.toJSONEntry();
        res.put(options.getName(), options.toJSONEntry());
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new ConfigurationException("Configuration should be a JSON object");
        Map<Object, Object> json = new HashMap<>((Map<?, ?>)jsonEntry);
        Object adv = json.remove(options.getName());
        try {
            geometry.initFromJSONEntry(json);
            if (adv!=null) options.initFromJSONEntry(adv);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: "+e.getMessage(), e);
        }
    }

    public static DarkTrackConfiguration parse(String json) {
        try {
            DarkTrackConfiguration res = new DarkTrackConfiguration();
            res.initFromJSONEntry(JSONUtils.parse(json));
            return res;
        } catch (ParseException e) {
            throw new ConfigurationException("Could not parse configuration: "+e, e);
        }
    }

    public static DarkTrackConfiguration read(Path file) throws IOException {
        logger.debug("reading configuration: {}", file);
        return parse(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return geometry+" "+options;
    }
}
