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
package darktrack.configuration.parameters;

import darktrack.utils.JSONSerializable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 *
 * @author Jean Ollion
 */
public interface Parameter<P extends Parameter<P>> extends JSONSerializable {
    Logger logger = LoggerFactory.getLogger(Parameter.class);
    String getName();
    void setName(String name);
    String getHintText();
    P setHint(String tip);
    P addValidationFunction(Predicate<P> validationFunction);
    boolean isValid();
    /**
     *
     * @return whether a value has been set, either by default or by initialization
     */
    boolean isSet();
}
