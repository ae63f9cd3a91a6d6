/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of DarkTrack
 *
 * DarkTrack is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * DarkTrack is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DarkTrack.  If not, see <http://www.gnu.org/licenses/>.
 */
package darktrack.utils;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a table of rows as a text file, values separated by {@link #separator}. NaN values are written as NaN
 * @author Jean Ollion
 */
public class ArrayFileWriter {
    final static String separator =";";

    final List<double[]> rows = new ArrayList<>();
    public ArrayFileWriter addRow(double[] row) {
        rows.add(row);
        return this;
    }
    public ArrayFileWriter addRows(double[][] rows) {
        for (double[] r : rows) addRow(r);
        return this;
    }
    public void writeToFile(String outputFile) throws IOException {
        File output = new File(outputFile);
        try (BufferedWriter out = new BufferedWriter(new FileWriter(output))) {
            boolean first = true;
            for (double[] row : rows) {
                if (!first) out.newLine();
                first = false;
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i<row.length; ++i) {
                    if (i>0) sb.append(separator);
                    sb.append(row[i]);
                }
                out.write(sb.toString());
            }
        }
    }
}
