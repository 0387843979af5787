package org.example.questionnaire.io;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import org.example.questionnaire.logic.Connective;
import org.example.questionnaire.logic.LogicExpr;
import org.example.questionnaire.logic.Operation;

/**
 * JSON form of condition trees:
 * <pre>
 * {"type": "condition", "subject": "n7", "operation": ">=", "value": 5}
 * {"type": "operator", "operation": "AND", "children": [ ... ]}
 * </pre>
 * True and false are the empty AND and the empty OR.
 */
public final class LogicJson {

    private LogicJson() {
    }

    public static JSONObject toJson(LogicExpr expr) {
        JSONObject obj = new JSONObject();
        if (expr instanceof LogicExpr.Condition c) {
            obj.put("type", "condition");
            obj.put("subject", c.subject());
            obj.put("operation", c.operation().symbol());
            obj.put("value", c.value());
        } else {
            LogicExpr.Operator op = (LogicExpr.Operator) expr;
            obj.put("type", "operator");
            obj.put("operation", op.operation().name());
            JSONArray children = new JSONArray();
            for (LogicExpr child : op.children()) {
                children.put(toJson(child));
            }
            obj.put("children", children);
        }
        return obj;
    }

    /** {@link JSONObject#NULL} for an unconditioned edge. */
    public static Object toJsonOrNull(LogicExpr expr) {
        return expr == null ? JSONObject.NULL : toJson(expr);
    }

    /**
     * @throws JSONException if the object is not a condition tree
     */
    public static LogicExpr fromJson(JSONObject obj) {
        String type = obj.getString("type");
        switch (type) {
            case "condition": {
                Object value = obj.get("value");
                if (value instanceof Number n) value = new BigDecimal(n.toString());
                try {
                    return LogicExpr.condition(obj.getString("subject"), Operation.fromSymbol(obj.getString("operation")), value);
                } catch (IllegalArgumentException e) {
                    throw new JSONException(e.getMessage(), e);
                }
            }
            case "operator": {
                Connective connective;
                try {
                    connective = Connective.valueOf(obj.getString("operation"));
                } catch (IllegalArgumentException e) {
                    throw new JSONException("Unknown connective: " + obj.getString("operation"), e);
                }
                JSONArray array = obj.getJSONArray("children");
                List<LogicExpr> children = new ArrayList<>(array.length());
                for (int i = 0; i < array.length(); i++) {
                    children.add(fromJson(array.getJSONObject(i)));
                }
                try {
                    return new LogicExpr.Operator(connective, children);
                } catch (IllegalArgumentException e) {
                    throw new JSONException(e.getMessage(), e);
                }
            }
            default:
                throw new JSONException("Unknown logic node type: " + type);
        }
    }
}
