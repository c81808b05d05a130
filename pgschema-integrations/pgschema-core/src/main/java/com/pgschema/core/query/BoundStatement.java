package com.pgschema.core.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * SQL text with named {@code :name} markers plus the values bound to them, in
 * the order the markers were appended. Immutable; built fresh per request.
 */
public final class BoundStatement {

    /** One named parameter value. */
    public static final class Parameter {
        private final String name;
        private final Object value;

        public Parameter(String name, Object value) {
            this.name  = Objects.requireNonNull(name, "name");
            this.value = value;
        }

        public String getName()  { return name; }
        public Object getValue() { return value; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Parameter)) return false;
            Parameter p = (Parameter) o;
            return name.equals(p.name) && Objects.equals(value, p.value);
        }

        @Override
        public int hashCode() { return Objects.hash(name, value); }

        @Override
        public String toString() { return name + "=" + value; }
    }

    private final String          text;
    private final List<Parameter> parameters;

    public BoundStatement(String text, List<Parameter> parameters) {
        this.text       = Objects.requireNonNull(text, "text");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public String          getText()       { return text; }
    public List<Parameter> getParameters() { return parameters; }

    public List<String> getParameterNames() {
        return parameters.stream().map(Parameter::getName).toList();
    }

    /**
     * Value bound to {@code name}.
     *
     * @throws IllegalArgumentException if nothing is bound under that name
     */
    public Object valueOf(String name) {
        for (Parameter p : parameters) {
            if (p.name.equals(name)) return p.value;
        }
        throw new IllegalArgumentException("No parameter bound for :" + name);
    }

    @Override
    public String toString() {
        return "BoundStatement{text='" + text + "', parameters=" + getParameterNames() + '}';
    }
}
