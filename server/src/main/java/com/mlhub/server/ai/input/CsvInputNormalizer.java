package com.mlhub.server.ai.input;

import com.mlhub.server.ai.inference.BackendHandle;
import com.mlhub.server.ai.tensor.CanonicalTensor;
import com.mlhub.server.ai.tensor.ModelInput;
import com.mlhub.server.api.PredictRequest;
import com.mlhub.server.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Comma-separated rows from {@code csv_data} as a (rows, columns) tensor. A
 * first row that is not entirely numeric is a header and is dropped.
 */
public class CsvInputNormalizer implements InputNormalizer {

    @Override
    public InputKind getKind() {
        return InputKind.CSV;
    }

    @Override
    public void validate(PredictRequest request) {
        parse(request.csvData);
    }

    @Override
    public ModelInput normalize(PredictRequest request, BackendHandle handle) {
        return ShapeChecks.requireCompatible(parse(request.csvData), handle, "csv_data");
    }

    public CanonicalTensor parse(String csv) {
        if (csv == null || csv.trim().isEmpty()) {
            throw new ValidationException("csv_data is required");
        }
        List<String[]> rows = new ArrayList<>();
        for (String line : csv.split("\\r?\\n")) {
            if (!line.trim().isEmpty()) {
                rows.add(line.split(",", -1));
            }
        }
        if (!rows.isEmpty() && parseRow(rows.get(0)) == null) {
            rows.remove(0);
        }
        if (rows.isEmpty()) {
            throw new ValidationException("csv_data has no data rows");
        }

        int cols = rows.get(0).length;
        float[] values = new float[rows.size() * cols];
        for (int r = 0; r < rows.size(); r++) {
            String[] cells = rows.get(r);
            if (cells.length != cols) {
                throw new ValidationException("csv_data row " + (r + 1) + " has " + cells.length
                        + " columns, expected " + cols);
            }
            float[] parsed = parseRow(cells);
            if (parsed == null) {
                throw new ValidationException("csv_data row " + (r + 1) + " is not numeric");
            }
            System.arraycopy(parsed, 0, values, r * cols, cols);
        }
        return CanonicalTensor.ofFloats(values, rows.size(), cols);
    }

    /**
     * @return the row as floats, or null if any cell is not a number
     */
    private static float[] parseRow(String[] cells) {
        float[] out = new float[cells.length];
        for (int i = 0; i < cells.length; i++) {
            try {
                out[i] = Float.parseFloat(cells[i].trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return out;
    }
}
