package ru.aritmos.padlock.trusted;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Позиционные аргументы trusted-провайдера.
 * <p>
 * Значения: результат разбора JSON: String, Number, Boolean, Map, List или {@code null}.
 */
public final class TrustedArguments {

    private static final TrustedArguments EMPTY = new TrustedArguments(List.of());

    private final List<Object> values;

    private TrustedArguments(List<Object> values) {
        this.values = values;
    }

    public static TrustedArguments empty() {
        return EMPTY;
    }

    public static TrustedArguments of(List<?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // List.copyOf не допускает null-элементов, а null: допустимый JSON-аргумент.
        return new TrustedArguments(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public List<Object> values() {
        return values;
    }

    /**
     * @return аргумент по позиции или {@code null}, если аргументов меньше
     */
    public Object get(int index) {
        return index >= 0 && index < values.size() ? values.get(index) : null;
    }

    /**
     * @return строковое представление аргумента или {@code null}
     */
    public String string(int index) {
        Object v = get(index);
        return v == null ? null : String.valueOf(v);
    }

    @Override
    public String toString() {
        // значения могут быть паролями
        return "TrustedArguments[size=" + values.size() + "]";
    }
}
