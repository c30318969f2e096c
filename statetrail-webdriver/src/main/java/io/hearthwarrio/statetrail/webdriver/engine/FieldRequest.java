package io.hearthwarrio.statetrail.webdriver.engine;

import io.hearthwarrio.statetrail.core.FieldSynonymClass;
import io.hearthwarrio.statetrail.core.TaskContext;

import java.util.Objects;

/**
 * One requested field of a fill action.
 */
public final class FieldRequest {

    private final String fieldName;
    private final String value;
    private final TaskContext task;
    private final FieldSynonymClass synonymClass;

    public FieldRequest(String fieldName, String value, TaskContext task) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
        this.value = value == null ? "" : value;
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.synonymClass = FieldSynonymClass.of(fieldName);
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getValue() {
        return value;
    }

    public TaskContext getTask() {
        return task;
    }

    public FieldSynonymClass getSynonymClass() {
        return synonymClass;
    }

    @Override
    public String toString() {
        return "FieldRequest{'" + fieldName + "', " + synonymClass + '}';
    }
}
