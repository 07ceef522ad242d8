package com.ivamare.eventsourcing.query.middleware;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.query.PaginatedResult;
import com.ivamare.eventsourcing.query.Query;
import com.ivamare.eventsourcing.query.QueryMiddleware;

import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prunes results to the query's requested fields.
 *
 * <p>Supports one level of nesting ({@code "owner.name"}). Collections and paginated
 * results are pruned item by item. Objects that are not maps are converted to maps
 * with Jackson first. Scalars, strings, collections and arrays are never descended
 * into: a nested path through one is skipped, and such a result is returned as is.
 * Queries without fields pass through untouched.
 */
public class FieldSelectionMiddleware implements QueryMiddleware {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FieldSelectionMiddleware(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Object handle(Query query, Next next) throws Exception {
        Object result = next.proceed();
        List<String> fields = query.fields();
        if (fields.isEmpty() || result == null) {
            return result;
        }
        if (result instanceof PaginatedResult<?> page) {
            return new PaginatedResult<>(selectAll(page.items(), fields),
                page.page(), page.pageSize(), page.totalItems());
        }
        if (result instanceof Collection<?> items) {
            return selectAll(items, fields);
        }
        return select(result, fields);
    }

    private List<Object> selectAll(Collection<?> items, List<String> fields) {
        return items.stream().map(item -> select(item, fields)).toList();
    }

    private Object select(Object item, List<String> fields) {
        if (!isObject(item)) {
            return item;
        }
        return selectFields(toMap(item), fields);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> selectFields(Map<String, Object> source, List<String> fields) {
        Map<String, Object> selected = new LinkedHashMap<>();
        Set<String> nestedParents = new HashSet<>();
        for (String field : fields) {
            int dot = field.indexOf('.');
            if (dot < 0) {
                if (source.containsKey(field)) {
                    nestedParents.remove(field);
                    selected.put(field, source.get(field));
                }
                continue;
            }
            String parent = field.substring(0, dot);
            String child = field.substring(dot + 1);
            Object nested = source.get(parent);
            if (!isObject(nested) || (selected.containsKey(parent) && !nestedParents.contains(parent))) {
                continue;
            }
            Map<String, Object> nestedMap = toMap(nested);
            if (nestedMap.containsKey(child)) {
                nestedParents.add(parent);
                ((Map<String, Object>) selected.computeIfAbsent(parent, k -> new LinkedHashMap<String, Object>()))
                    .put(child, nestedMap.get(child));
            }
        }
        return selected;
    }

    private static boolean isObject(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Map<?, ?>) {
            return true;
        }
        return !(value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Enum<?>
            || value instanceof Temporal
            || value instanceof Collection<?>
            || value.getClass().isArray());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return objectMapper.convertValue(value, MAP_TYPE);
    }
}
