package com.mlhub.server.ai.output;

import java.util.EnumMap;
import java.util.Map;

public class OutputFormatterFactory {

    private final Map<OutputKind, OutputFormatter> formatters = new EnumMap<>(OutputKind.class);

    public OutputFormatterFactory() {
        register(new ClassificationOutputFormatter());
        register(new RegressionOutputFormatter());
        register(new ImageOutputFormatter());
        register(new PassthroughOutputFormatter(OutputKind.TEXT));
        register(new PassthroughOutputFormatter(OutputKind.JSON));
    }

    private void register(OutputFormatter formatter) {
        formatters.put(formatter.getKind(), formatter);
    }

    public OutputFormatter forKind(OutputKind kind) {
        OutputFormatter formatter = formatters.get(kind);
        if (formatter == null) {
            throw new IllegalStateException("No formatter for " + kind);
        }
        return formatter;
    }
}
