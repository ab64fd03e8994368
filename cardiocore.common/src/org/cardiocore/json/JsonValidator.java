package org.cardiocore.json;

import org.cardiocore.exceptions.JsonParsingException;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON validation utilities
 */
public class JsonValidator {

    /**
     * Validate that a string is valid JSON
     */
    public static boolean isValidJson(String jsonString) {
        if (jsonString == null || jsonString.trim().isEmpty()) {
            return false;
        }
        try {
            new JSONParser().parse(jsonString);
            return true;
        } catch (ParseException e) {
            return false;
        }
    }

    /**
     * Parse a JSON object, failing with position information when the text is
     * not JSON or not an object. JSONParser is not thread-safe, so each call
     * gets its own.
     */
    public static JSONObject parseObject(String jsonString) throws JsonParsingException {
        if (jsonString == null || jsonString.trim().isEmpty()) {
            throw new JsonParsingException("Empty JSON input", jsonString);
        }
        Object parsed;
        try {
            parsed = new JSONParser().parse(jsonString);
        } catch (ParseException e) {
            throw new JsonParsingException("Invalid JSON: " + e, e, jsonString, e.getPosition());
        }
        if (!(parsed instanceof JSONObject)) {
            throw new JsonParsingException("Expected a JSON object", jsonString);
        }
        return (JSONObject) parsed;
    }

    /**
     * Validate that JSON contains required fields
     */
    public static boolean hasRequiredFields(String jsonString, String... requiredFields) {
        JSONObject json;
        try {
            json = parseObject(jsonString);
        } catch (JsonParsingException e) {
            return false;
        }
        for (String field : requiredFields) {
            if (!json.containsKey(field)) {
                return false;
            }
        }
        return true;
    }
}
