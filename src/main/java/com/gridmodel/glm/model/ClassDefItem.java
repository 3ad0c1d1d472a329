package com.gridmodel.glm.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * A {@code class <name> { <type> <variable>; ... }} definition.
 *
 * Declarations live in two parallel lists because several variables may
 * share a type. The inherited field map is the fallback used when the
 * lists do not pair up.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ClassDefItem extends FieldedItem {
    private String name;
    private List<String> variableTypes = new ArrayList<>();
    private List<String> variableNames = new ArrayList<>();

    @Builder
    public ClassDefItem(String name, @Singular List<String> variableTypes, @Singular List<String> variableNames,
                        @Singular Map<String, String> fields, int sourceLine) {
        this.name = name;
        this.variableTypes = variableTypes != null ? new ArrayList<>(variableTypes) : new ArrayList<>();
        this.variableNames = variableNames != null ? new ArrayList<>(variableNames) : new ArrayList<>();
        this.fields = copyFields(fields);
        this.sourceLine = sourceLine;
    }

    public void addDeclaration(String variableType, String variableName) {
        variableTypes.add(variableType);
        variableNames.add(variableName);
    }

    public boolean hasPairedDeclarations() {
        return !variableTypes.isEmpty() && variableTypes.size() == variableNames.size();
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return "class " + name;
    }
}
