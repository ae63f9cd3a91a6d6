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

import java.util.function.Predicate;

/**
 *
 * @author Jean Ollion
 */
public abstract class ParameterImpl<P extends ParameterImpl<P>> implements Parameter<P> {
    protected String name;
    protected Predicate<P> additionalValidation = p->true;
    protected String toolTipText;

    protected ParameterImpl(String name) {
        this.name=name;
    }
    @Override
    public String getHintText() {
        return toolTipText;
    }
    @Override
    public P setHint(String tip) {
        this.toolTipText= tip;
        return (P)this;
    }
    @Override
    public P addValidationFunction(Predicate<P> validationFunction) {
        this.additionalValidation = this.additionalValidation.and(validationFunction);
        return (P)this;
    }
    @Override 
    public boolean isValid() {
        if (additionalValidation==null) return true;
        return additionalValidation.test((P)this);
    }
    @Override
    public String getName(){
        return name;
    }
    @Override
    public void setName(String name) {
        this.name=name;
    }
    @Override
    public String toString() {
        return name;
    }
}
