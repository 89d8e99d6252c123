/**
 *
 */
package org.theseed.cobra.io.sbml;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object translates between SBML identifiers and canonical model identifiers.
 *
 * SBML identifiers are restricted to letters, digits, and underscores, so the usual convention
 * is to give every identifier a type prefix ("M_", "R_", "G_", "C_"), to express a metabolite's
 * compartment as a trailing "_c" instead of "[c]", and to escape any other illegal character as
 * "__<code>__", where <code> is the decimal character code.
 *
 * When reading, the decisions are made for the whole model at once.  A prefix is removed only if
 * every identifier of that type has it, and compartment suffixes are converted only if every
 * non-boundary metabolite has the suffix for its own compartment.  If only some of the identifiers
 * follow a convention, none of them are changed.  The fraction that must follow the convention is
 * a tunable threshold that defaults to 1 (all-or-nothing).
 */
public class IdentifierNormalizer {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(IdentifierNormalizer.class);
    /** fraction of identifiers that must follow a convention for it to be applied */
    private static double THRESHOLD = 1.0;
    /** pattern for an escaped character */
    private static final Pattern ESCAPE = Pattern.compile("__(\\d+)__");
    /** pattern for a canonical metabolite ID with a compartment */
    private static final Pattern BRACKET_ID = Pattern.compile("(.+)\\[([^\\[\\]]+)\\]");
    /** pattern for text whose final underscore closes an escape sequence */
    private static final Pattern ESCAPE_TAIL = Pattern.compile(".*__\\d+_");
    /** escaped form of an underscore */
    private static final String ESCAPED_UNDERSCORE = "__95__";

    /**
     * This enumeration describes the types of SBML identifiers and their prefixes.
     */
    public static enum Type {
        METABOLITE("M_"), REACTION("R_"), GENE("G_"), COMPARTMENT("C_");

        /** identifier prefix */
        private final String prefix;

        private Type(String prefix) {
            this.prefix = prefix;
        }

        /**
         * @return the identifier prefix for this type
         */
        public String getPrefix() {
            return this.prefix;
        }
    }

    /**
     * Specify the fraction of identifiers that must follow a convention for the convention to be
     * applied to the model.
     *
     * @param threshold		new threshold, greater than 0 and no more than 1
     */
    public static void setThreshold(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0)
            throw new IllegalArgumentException("Normalization threshold must be greater than 0 and no more than 1.");
        THRESHOLD = threshold;
    }

    /**
     * @return the fraction of identifiers that must follow a convention for it to be applied
     */
    public static double getThreshold() {
        return THRESHOLD;
    }

    /**
     * @return TRUE if enough of the items follow a convention
     *
     * @param found		number of items following the convention
     * @param total		total number of items
     */
    private static boolean enough(int found, int total) {
        return (found > 0 && found >= THRESHOLD * total);
    }

    /**
     * Compute the canonical identifiers for a set of SBML identifiers of one type.  The prefix
     * is removed if enough of the identifiers have it, and escaped characters are restored.
     *
     * @param type		type of identifier
     * @param sbmlIds	SBML identifiers to translate
     *
     * @return a map from each SBML identifier to its canonical identifier, in input order
     */
    public Map<String, String> stripPrefixes(Type type, Collection<String> sbmlIds) {
        Map<String, String> retVal = this.removePrefixes(type, sbmlIds);
        retVal.replaceAll((k, v) -> unescape(v));
        return retVal;
    }

    /**
     * Remove the type prefix from a set of SBML identifiers of one type if enough of them have
     * it.  Escaped characters are left escaped.
     *
     * @param type		type of identifier
     * @param sbmlIds	SBML identifiers to translate
     *
     * @return a map from each SBML identifier to its unprefixed identifier, in input order
     */
    public Map<String, String> removePrefixes(Type type, Collection<String> sbmlIds) {
        String prefix = type.getPrefix();
        int found = (int) sbmlIds.stream().filter(x -> x.startsWith(prefix) && x.length() > prefix.length()).count();
        boolean strip = enough(found, sbmlIds.size());
        if (! strip && found > 0)
            log.debug("Prefix \"{}\" found on only {} of {} {} IDs; prefixes retained.", prefix, found,
                    sbmlIds.size(), type);
        Map<String, String> retVal = new LinkedHashMap<String, String>(sbmlIds.size() * 4 / 3 + 1);
        for (String sbmlId : sbmlIds) {
            String id = sbmlId;
            if (strip && id.startsWith(prefix) && id.length() > prefix.length())
                id = id.substring(prefix.length());
            retVal.put(sbmlId, id);
        }
        return retVal;
    }

    /**
     * Convert compartment suffixes on metabolite identifiers to the canonical bracket form.  This
     * is only done if enough of the non-boundary metabolites have the suffix for their own
     * compartment.  If it is done, every metabolite with a matching suffix is converted,
     * including boundary metabolites.
     *
     * @param compartmentMap	map from each metabolite identifier to its compartment ID
     * @param boundary			set of identifiers for boundary metabolites
     *
     * @return a map from each input identifier to its final identifier, in input order
     */
    public Map<String, String> splitCompartments(Map<String, String> compartmentMap, Set<String> boundary) {
        int total = 0;
        int found = 0;
        for (Map.Entry<String, String> entry : compartmentMap.entrySet()) {
            if (! boundary.contains(entry.getKey())) {
                total++;
                if (hasSuffix(entry.getKey(), entry.getValue()))
                    found++;
            }
        }
        boolean split = enough(found, total);
        if (! split && found > 0)
            log.debug("Compartment suffix found on only {} of {} metabolite IDs; IDs retained.", found, total);
        Map<String, String> retVal = new LinkedHashMap<String, String>(compartmentMap.size() * 4 / 3 + 1);
        for (Map.Entry<String, String> entry : compartmentMap.entrySet()) {
            String id = entry.getKey();
            String comp = entry.getValue();
            if (split && hasSuffix(id, comp))
                id = id.substring(0, id.length() - comp.length() - 1) + "[" + comp + "]";
            retVal.put(entry.getKey(), id);
        }
        return retVal;
    }

    /**
     * @return TRUE if the identifier ends with an underscore followed by the compartment ID and
     * 		   the underscore is not the end of an escape sequence
     *
     * @param id		identifier to check
     * @param comp		compartment ID
     */
    private static boolean hasSuffix(String id, String comp) {
        boolean retVal = (comp != null && ! comp.isEmpty() && id.length() > comp.length() + 1
                && id.endsWith("_" + comp));
        if (retVal)
            retVal = ! ESCAPE_TAIL.matcher(id.substring(0, id.length() - comp.length() - 1)).matches();
        return retVal;
    }

    /**
     * Compute the SBML identifier for a canonical identifier.
     *
     * @param type		type of identifier
     * @param id		canonical identifier
     *
     * @return the prefixed and escaped SBML identifier
     */
    public String toSbmlId(Type type, String id) {
        return type.getPrefix() + escape(id);
    }

    /**
     * Compute the SBML identifiers for a model's metabolites.  If every non-boundary metabolite
     * carries its own compartment in brackets, the brackets become an underscore suffix, which
     * the reader converts back.  Otherwise the brackets are escaped, and so is the underscore of
     * any identifier that already ends with its compartment suffix, so that the reader leaves
     * the identifiers unchanged.
     *
     * @param compartmentMap	map from each canonical metabolite identifier to its compartment ID
     * @param boundary			set of identifiers for boundary metabolites
     *
     * @return a map from each canonical identifier to its prefixed and escaped SBML identifier
     */
    public Map<String, String> toSbmlMetaboliteIds(Map<String, String> compartmentMap, Set<String> boundary) {
        int total = 0;
        int found = 0;
        for (Map.Entry<String, String> entry : compartmentMap.entrySet()) {
            if (! boundary.contains(entry.getKey())) {
                total++;
                if (bracketBase(entry.getKey(), entry.getValue()) != null)
                    found++;
            }
        }
        boolean join = (found > 0 && found == total);
        Map<String, String> retVal = new LinkedHashMap<String, String>(compartmentMap.size() * 4 / 3 + 1);
        for (Map.Entry<String, String> entry : compartmentMap.entrySet()) {
            String id = entry.getKey();
            String comp = entry.getValue();
            String base = bracketBase(id, comp);
            String sbmlId;
            if (join && base != null)
                sbmlId = escape(base) + "_" + escape(comp);
            else if (comp != null && ! comp.isEmpty() && id.length() > comp.length() + 1 && id.endsWith("_" + comp))
                sbmlId = escape(id.substring(0, id.length() - comp.length() - 1)) + ESCAPED_UNDERSCORE + escape(comp);
            else
                sbmlId = escape(id);
            retVal.put(id, Type.METABOLITE.getPrefix() + sbmlId);
        }
        return retVal;
    }

    /**
     * @return the part of a metabolite identifier before its bracketed compartment, or NULL if the
     * 		   identifier does not end with the specified compartment in brackets
     *
     * @param id		canonical metabolite identifier
     * @param comp		compartment ID
     */
    private static String bracketBase(String id, String comp) {
        String retVal = null;
        Matcher m = BRACKET_ID.matcher(id);
        if (m.matches() && m.group(2).equals(comp))
            retVal = m.group(1);
        return retVal;
    }

    /**
     * Escape the characters in an identifier that are not legal in SBML.
     *
     * @param id	identifier to escape
     *
     * @return the escaped identifier
     */
    public static String escape(String id) {
        StringBuilder retVal = new StringBuilder(id.length() + 10);
        id.codePoints().forEach(c -> {
            if (c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'))
                retVal.appendCodePoint(c);
            else
                retVal.append("__").append(c).append("__");
        });
        return retVal.toString();
    }

    /**
     * Restore the escaped characters in an identifier.
     *
     * @param id	identifier to unescape
     *
     * @return the unescaped identifier
     */
    public static String unescape(String id) {
        Matcher m = ESCAPE.matcher(id);
        StringBuilder retVal = new StringBuilder(id.length());
        int pos = 0;
        while (m.find()) {
            retVal.append(id, pos, m.start());
            int code = -1;
            String digits = m.group(1);
            if (digits.length() <= 7)
                code = Integer.parseInt(digits);
            if (Character.isValidCodePoint(code))
                retVal.appendCodePoint(code);
            else
                retVal.append(m.group());
            pos = m.end();
        }
        retVal.append(id.substring(pos));
        return retVal.toString();
    }

}
