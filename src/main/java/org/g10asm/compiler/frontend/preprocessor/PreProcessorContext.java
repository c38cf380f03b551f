package org.g10asm.compiler.frontend.preprocessor;

import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroFrame;
import org.g10asm.compiler.frontend.preprocessor.features.macro.MacroTable;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A shared context for the preprocessor phase.
 * Contains all state that directive handlers read or modify: the macro table, the active
 * macro invocations, the include stack and the adjustable limits.
 */
public class PreProcessorContext {

    private final MacroTable macroTable = new MacroTable();
    private final Deque<MacroFrame> macroFrames = new ArrayDeque<>();
    private final Deque<String> fileStack = new ArrayDeque<>();
    private final Set<String> onceFiles = new HashSet<>();
    private final List<Path> includeDirs;
    private int maxRecursionDepth;
    private int maxIncludeDepth;
    private int loopDepth = 0;
    private boolean aborted = false;

    public PreProcessorContext(PreProcessorConfig config, String mainFile) {
        this.maxRecursionDepth = config.maxRecursionDepth();
        this.maxIncludeDepth = config.maxIncludeDepth();
        this.includeDirs = config.includeDirs();
        this.fileStack.push(mainFile);
    }

    public MacroTable getMacroTable() {
        return macroTable;
    }

    // Macro invocations

    public void pushFrame(MacroFrame frame) {
        macroFrames.push(frame);
    }

    public void popFrame() {
        macroFrames.pop();
    }

    /**
     * @return The innermost active macro invocation, if any.
     */
    public Optional<MacroFrame> currentFrame() {
        return Optional.ofNullable(macroFrames.peek());
    }

    // Files

    /**
     * Enters an included file.
     * @param file The absolute path of the file.
     * @return {@code false} if the include depth limit is exceeded.
     */
    public boolean pushFile(String file) {
        fileStack.push(file);
        return includeDepth() <= maxIncludeDepth;
    }

    /**
     * Leaves the current included file. The main file is never popped.
     */
    public void popFile() {
        if (fileStack.size() > 1) {
            fileStack.pop();
        }
    }

    public String currentFile() {
        return fileStack.peek();
    }

    /**
     * @return The number of files currently being included, 0 while in the main file.
     */
    public int includeDepth() {
        return fileStack.size() - 1;
    }

    public void markOnce(String file) {
        onceFiles.add(file);
    }

    public boolean isOnce(String file) {
        return onceFiles.contains(file);
    }

    public List<Path> getIncludeDirs() {
        return includeDirs;
    }

    // Limits

    public int getMaxRecursionDepth() {
        return maxRecursionDepth;
    }

    public void setMaxRecursionDepth(int maxRecursionDepth) {
        this.maxRecursionDepth = maxRecursionDepth;
    }

    public int getMaxIncludeDepth() {
        return maxIncludeDepth;
    }

    public void setMaxIncludeDepth(int maxIncludeDepth) {
        this.maxIncludeDepth = maxIncludeDepth;
    }

    // Loops

    public void enterLoop() {
        loopDepth++;
    }

    public void exitLoop() {
        loopDepth--;
    }

    public boolean isInLoop() {
        return loopDepth > 0;
    }

    // Fatal errors

    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }
}
