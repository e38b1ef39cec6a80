/*
 * Docx2Tex - Office Open XML to LaTeX Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.docx2tex.latex;

import java.util.List;

/** Text placed around the converted body to make a complete LaTeX file. */
public record Preamble(String documentClass, List<String> packages) {

    public Preamble {
        packages = List.copyOf(packages);
    }

    public String opening() {
        StringBuilder sb = new StringBuilder();
        sb.append("\\documentclass{").append(documentClass).append("}\n");
        for (String pkg : packages) {
            sb.append("\\usepackage{").append(pkg).append("}\n");
        }
        sb.append("\n\\begin{document}\n\n");
        return sb.toString();
    }

    public String closing() {
        return "\\end{document}\n";
    }
}
