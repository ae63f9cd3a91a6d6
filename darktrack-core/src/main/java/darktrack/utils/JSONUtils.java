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
package darktrack.utils;

import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public static String toJSONString(Object jsonObjectOrArray) {
        if (jsonObjectOrArray instanceof JSONAware) return ((JSONAware)jsonObjectOrArray).toJSONString();
        else if (jsonObjectOrArray instanceof String) return (String)jsonObjectOrArray;
        else throw new IllegalArgumentException("Object is not JSONObject or JSONArray");
    }
    public static String serialize(JSONSerializable o) {
        return toJSONString(o.toJSONEntry());
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        if (!(res instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, res);
        return (JSONObject)res;
    }
}
