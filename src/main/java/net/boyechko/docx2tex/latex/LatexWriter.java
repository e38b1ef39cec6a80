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

import java.io.IOException;
import java.io.Writer;
import java.util.Optional;

/** Writes LaTeX fragments to the output in call order. */
public class LatexWriter {
    private final Writer out;

    public LatexWriter(Writer out) {
        this.out = out;
    }

    public void write(String fragment) throws IOException {
        out.write(fragment);
    }

    public void newline() throws IOException {
        out.write('\n');
    }

    public void macro(String name) throws IOException {
        out.write('\\');
        out.write(name);
    }

    /** {@code \hyperlink{anchor}{content}} */
    public void hyperlink(String anchor, String content) throws IOException {
        out.write("\\hyperlink{" + anchor + "}{" + content + "}");
    }

    /** {@code \href{url}{content}} */
    public void href(String url, String content) throws IOException {
        out.write("\\href{" + url + "}{" + content + "}");
    }

    /** Opens a bookmark target; the matching {@code }} comes with the bookmark end. */
    public void hypertarget(String anchor) throws IOException {
        out.write("\\hypertarget{" + anchor + "}{");
    }

    /** {@code \includegraphics[options]{stem}}; the brackets are omitted without options. */
    public void includeGraphics(String options, String stem) throws IOException {
        if (options == null || options.isBlank()) {
            out.write("\\includegraphics{" + stem + "}");
        } else {
            out.write("\\includegraphics[" + options + "]{" + stem + "}");
        }
    }

    public void flush() throws IOException {
        out.flush();
    }

    /**
     * Returns the file name of {@code target} without its last extension, like {@code image1} for
     * {@code media/image1.png}. Empty when the target does not end in a file name.
     */
    public static Optional<String> fileStem(String target) {
        if (target == null) {
            return Optional.empty();
        }
        int slash = Math.max(target.lastIndexOf('/'), target.lastIndexOf('\\'));
        String fileName = target.substring(slash + 1);
        if (fileName.isEmpty() || fileName.equals(".") || fileName.equals("..")) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        return Optional.of(dot > 0 ? fileName.substring(0, dot) : fileName);
    }
}
