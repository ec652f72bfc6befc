package me.christianrobert.trylower.transformation.context;

/**
 * Immutable snapshot of the settings that influence one lowering run.
 */
public class LoweringOptions {

    public static final String DEFAULT_TEMP_PREFIX = "$t";

    private final boolean unreachableHandlerFatal;
    private final boolean includeDebugTree;
    private final String tempPrefix;

    public LoweringOptions(boolean unreachableHandlerFatal, boolean includeDebugTree, String tempPrefix) {
        if (tempPrefix == null || tempPrefix.trim().isEmpty()) {
            throw new IllegalArgumentException("Temp prefix cannot be null or empty");
        }
        this.unreachableHandlerFatal = unreachableHandlerFatal;
        this.includeDebugTree = includeDebugTree;
        this.tempPrefix = tempPrefix;
    }

    public static LoweringOptions defaults() {
        return new LoweringOptions(false, false, DEFAULT_TEMP_PREFIX);
    }

    public boolean isUnreachableHandlerFatal() {
        return unreachableHandlerFatal;
    }

    public boolean isIncludeDebugTree() {
        return includeDebugTree;
    }

    public String getTempPrefix() {
        return tempPrefix;
    }

    @Override
    public String toString() {
        return "LoweringOptions{unreachableHandlerFatal=" + unreachableHandlerFatal +
                ", includeDebugTree=" + includeDebugTree + ", tempPrefix='" + tempPrefix + "'}";
    }
}
