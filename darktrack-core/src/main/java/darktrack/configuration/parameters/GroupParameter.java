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

import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Named group of parameters serialized as a JSON object keyed by parameter names
 * @author Jean Ollion
 */
public class GroupParameter<G extends GroupParameter<G>> extends ParameterImpl<G> {
    protected final List<Parameter> children;

    public GroupParameter(String name, Parameter... parameters) {
        super(name);
        this.children = new ArrayList<>(Arrays.asList(parameters));
    }

    public List<Parameter> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public boolean isSet() {
        return children.stream().allMatch(Parameter::isSet);
    }

    @Override
    public boolean isValid() {
        if (!super.isValid()) return false;
        return children.stream().allMatch(Parameter::isValid);
    }

    /**
     *
     * @return parameters that are not valid, recursively, with their path in the group
     */
    public List<String> getInvalidParameterNames() {
        List<String> res = new ArrayList<>();
        for (Parameter p : children) {
            if (p instanceof GroupParameter) {
                for (String s : ((GroupParameter<?>)p).getInvalidParameterNames()) res.add(p.getName()+"."+s);
            } else if (!p.isValid()) res.add(p.getName());
        }
        return res;
    }

    @Override
    public Object toJSONEntry() {
        JSONObject res = new JSONObject();
        for (Parameter p : children) {
            Object entry = p.toJSONEntry();
            if (entry!=null) res.put(p.getName(), entry);
        }
        return res;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (!(jsonEntry instanceof Map)) throw new IllegalArgumentException("Parameter "+name+": expected a JSON object, got: "+jsonEntry);
        Map json = (Map)jsonEntry;
        Map<String, Parameter> recieveMap = children.stream().collect(Collectors.toMap(Parameter::getName, Function.identity()));
        for (Object k : json.keySet()) {
            Parameter r = recieveMap.get(k.toString());
            if (r!=null) r.initFromJSONEntry(json.get(k));
            else logger.warn("Group {}: unknown parameter: {}", name, k);
        }
    }

    @Override
    public String toString() {
        return name+": "+children.stream().map(Object::toString).collect(Collectors.joining("; ", "[", "]"));
    }
}
