/**
 *
 */
package org.theseed.cobra.io;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This exception is thrown when a model file is readable but structurally invalid, e.g. it has
 * duplicate IDs or a reaction that references an unknown metabolite.
 */
public class SchemaViolationException extends MalformedInputException {

    /** serialization ID */
    private static final long serialVersionUID = -1706429961398104525L;
    /** list of individual problems */
    private final List<String> problems;

    /**
     * Construct a schema-violation exception.
     *
     * @param codec		name of the codec that failed
     * @param problems	list of structural problems found
     */
    public SchemaViolationException(String codec, List<String> problems) {
        super(codec, StringUtils.join(problems, "  "));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return the list of structural problems
     */
    public List<String> getProblems() {
        return this.problems;
    }

}
