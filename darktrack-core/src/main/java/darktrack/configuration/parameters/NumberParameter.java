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

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Locale;

/**
 *
 * @author Jean Ollion
 */
public class NumberParameter<P extends NumberParameter<P>> extends ParameterImpl<P> {
    Number value;
    int decimalPlaces;
    public NumberParameter(String name, int decimalPlaces) {
        super(name);
        this.decimalPlaces=decimalPlaces;
    }
    
    public NumberParameter(String name, int decimalPlaces, Number defaultValue) {
        this(name, decimalPlaces);
        this.value=defaultValue;
    }

    public int getDecimalPlaceNumber() {
        return decimalPlaces;
    }

    public Number getValue() {
        return value;
    }
    public int getIntValue() {return value.intValue();}

    public double getDoubleValue() {return value.doubleValue();}

    public P setValue(Number value) {
        this.value=value;
        return (P)this;
    }
    @Override
    public boolean isSet() {
        return value!=null;
    }
    @Override 
    public boolean isValid() {
        if (value==null || Double.isNaN(value.doubleValue())) return false;
        return super.isValid();
    }
    @Override
    public String toString() {
        return name+": "+ (value==null? "":trimDecimalPlaces(value, decimalPlaces));
    }

    @Override
    public Object toJSONEntry() {
        return value;
    }

    @Override
    public void initFromJSONEntry(Object jsonEntry) {
        if (jsonEntry instanceof Number) this.value=decimalPlaces>=1 ? ((Number)jsonEntry).doubleValue() : ((Number)jsonEntry).longValue();
        else if (jsonEntry instanceof String) {
            try {
                this.value = Double.parseDouble((String)jsonEntry);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Parameter "+name+": not a number: "+jsonEntry, e);
            }
        }
        else throw new IllegalArgumentException("Parameter "+name+": could not initialize from "+jsonEntry);
    }

    public static String trimDecimalPlaces(Number n, int digits) {
        DecimalFormat df = (DecimalFormat)NumberFormat.getInstance(Locale.US);
        df.setMaximumFractionDigits(digits);
        return df.format(n);
    }
}
