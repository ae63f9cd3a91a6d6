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

import org.json.simple.JSONArray;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

/**
 * List of values (typically two bounds) with optional global bounds. Values are kept in the given order; a decreasing list is invalid.
 * @author Jean Ollion
 */
public class IntervalParameter extends ParameterImpl<IntervalParameter> {
    Number[] values;
    Number lowerBound, upperBound;
    final int decimalPlaces;
    final int valueNumber;

    /**
     *
     * @param values default values; if null the parameter is not set and {@param valueNumber} values are expected
     */
    public IntervalParameter(String name, int decimalPlaces, Number lowerBound, Number upperBound, int valueNumber, Number... values) {
        super(name);
        if (lowerBound!=null && upperBound!=null && compare(lowerBound, upperBound)>0) throw new IllegalArgumentException("lower bound should be inferior to upper bound");
        if (valueNumber<1) throw new IllegalArgumentException("value number should be >=1");
        this.valueNumber = valueNumber;
        if (values!=null && values.length>0) setValues(values);
        this.lowerBound=lowerBound;
        this.upperBound=upperBound;
        this.decimalPlaces = decimalPlaces;
    }

    public static int compare(Number n1, Number n2) {
        return new BigDecimal(n1.toString()).compareTo(new BigDecimal(n2.toString()));
    }

    public double[] getValuesAsDouble() {
        return Arrays.stream(values).mapToDouble(Number::doubleValue).toArray();
    }

    public int getDecimalPlaces() {
        return decimalPlaces;
    }

    public IntervalParameter setValues(Number... values) {
        if (values.length!=valueNumber) throw new IllegalArgumentException("Parameter "+name+": expected "+valueNumber+" values, got "+values.length);
        this.values = Arrays.stream(values).map(Number::doubleValue).toArray(Number[]::new);
        return this;
    }

    public Number[] getValues() {
        return values;
    }

    @Override
    public boolean isSet() {
        return values!=null;
    }

    @Override
    public boolean isValid() {
        if (!super.isValid()) return false;
        if (values==null || values.length!=valueNumber) return false;
        for (int i = 1; i<values.length; ++i) if (compare(values[i], values[i-1])<0) return false;
        if (lowerBound!=null && compare(values[0], lowerBound)<0) return false;
        if (upperBound!=null && compare(values[values.length-1], upperBound)>0) return false;
        return true;
    }

    @Override
    public Object toJSONEntry() {
        JSONArray list= new JSONArray();
        if (values!=null) list.addAll(Arrays.asList(values));
        return list;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof List) {
            List list = (List) jsonEntry;
            Number[] newValues = new Number[list.size()];
            for (int i = 0; i < newValues.length; ++i) {
                if (!(list.get(i) instanceof Number)) throw new IllegalArgumentException("Parameter "+name+": not a number: "+list.get(i));
                newValues[i] = (Number) list.get(i);
            }
            setValues(newValues);
        } else throw new IllegalArgumentException("Parameter "+name+": could not initialize from "+jsonEntry);
    }

    @Override
    public String toString() {
        return name+": "+(values==null ? "" : Arrays.toString(values));
    }
}
