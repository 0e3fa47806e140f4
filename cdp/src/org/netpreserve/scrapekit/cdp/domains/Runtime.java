package org.netpreserve.scrapekit.cdp.domains;

import com.fasterxml.jackson.databind.JsonNode;

public interface Runtime {
    Evaluate evaluate(String expression, Boolean returnByValue, Boolean awaitPromise);

    record Evaluate(RemoteObject result, ExceptionDetails exceptionDetails) {
    }

    record RemoteObject(String type, String subtype, JsonNode value, String description) {
    }

    record ExceptionDetails(int exceptionId, String text, int lineNumber, int columnNumber,
                            RemoteObject exception) {
        public String describe() {
            if (exception != null && exception.description() != null) return exception.description();
            return text + " at " + lineNumber + ":" + columnNumber;
        }
    }
}
