package ca.uwaterloo.swag.flowlens.util;

import java.util.List;
import java.util.Map;

public class ArgumentOptions {

    public final List<String> argsList;
    public final Map<String, String> optsList;
    public final List<String> doubleOptsList;
    public final String sourceFile;

    public ArgumentOptions(List<String> argsList, Map<String, String> optsList, List<String> doubleOptsList,
                           String sourceFile) {
        this.argsList = argsList;
        this.optsList = optsList;
        this.doubleOptsList = doubleOptsList;
        this.sourceFile = sourceFile;
    }

    public boolean hasFlag(String flag) {
        return doubleOptsList.contains(flag);
    }

    public String option(String name, String defaultValue) {
        return optsList.getOrDefault(name, defaultValue);
    }
}
