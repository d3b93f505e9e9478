package com.sassed.function;

import com.sassed.value.SassList;
import com.sassed.value.SassMap;
import com.sassed.value.Value;
import com.sassed.value.ValueFormatter;

import java.util.List;
import java.util.Map;

/**
 * What built-in functions may ask of the evaluator that calls them.
 */
public interface FunctionContext {

    ValueFormatter formatter();

    String imagePath();

    boolean variableExists(String name);

    boolean globalVariableExists(String name);

    boolean functionExists(String name);

    boolean mixinExists(String name);

    Value call(String name, List<Value> positional, Map<String, Value> keywords);

    /**
     * Keyword arguments collected by a {@code $rest...} parameter, or an empty map.
     */
    SassMap keywordsOf(SassList argumentList);
}
