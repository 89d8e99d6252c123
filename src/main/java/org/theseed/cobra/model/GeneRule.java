/**
 *
 */
package org.theseed.cobra.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a gene-reaction rule:  a boolean expression over gene IDs that
 * indicates which gene products are needed to enable a reaction.  A rule is either empty,
 * a single gene, or an AND/OR operator over two or more sub-rules.  Nested operators of the
 * same type are flattened when the rule is built, so "a and (b and c)" is stored as a
 * three-way AND.
 *
 * The string form is the one used by COBRA "grRules":  lower-case operators, with every
 * operator sub-rule enclosed in parentheses.
 */
public class GeneRule {

    /**
     * Type of rule node.
     */
    public static enum Type {
        EMPTY, GENE, AND, OR;

        /**
         * @return the operator text for this type
         */
        public String getOperator() {
            return " " + this.name().toLowerCase() + " ";
        }
    }

    // FIELDS
    /** type of this node */
    private Type type;
    /** gene ID (for a GENE node) */
    private String gene;
    /** sub-rules (for an operator node) */
    private List<GeneRule> children;
    /** the empty rule */
    public static final GeneRule EMPTY = new GeneRule(Type.EMPTY, null, Collections.emptyList());

    /**
     * Construct a rule node.
     *
     * @param type		node type
     * @param gene		gene ID, or NULL for a non-leaf
     * @param children	list of sub-rules
     */
    private GeneRule(Type type, String gene, List<GeneRule> children) {
        this.type = type;
        this.gene = gene;
        this.children = children;
    }

    /**
     * @return a rule for a single gene
     *
     * @param geneId	ID of the gene
     */
    public static GeneRule gene(String geneId) {
        if (StringUtils.isBlank(geneId))
            throw new IllegalArgumentException("Gene ID in a rule cannot be blank.");
        return new GeneRule(Type.GENE, geneId, Collections.emptyList());
    }

    /**
     * @return a rule requiring all of the specified sub-rules
     *
     * @param parts		sub-rules to combine
     */
    public static GeneRule and(List<GeneRule> parts) {
        return combine(Type.AND, parts);
    }

    /**
     * @return a rule requiring any of the specified sub-rules
     *
     * @param parts		sub-rules to combine
     */
    public static GeneRule or(List<GeneRule> parts) {
        return combine(Type.OR, parts);
    }

    /**
     * Combine sub-rules under an operator.  Empty sub-rules are discarded, and sub-rules
     * with the same operator are merged into the new node.
     *
     * @param type		operator type
     * @param parts		sub-rules to combine
     *
     * @return the combined rule
     */
    private static GeneRule combine(Type type, List<GeneRule> parts) {
        List<GeneRule> kids = new ArrayList<GeneRule>(parts.size());
        for (GeneRule part : parts) {
            if (part.type == type)
                kids.addAll(part.children);
            else if (part.type != Type.EMPTY)
                kids.add(part);
        }
        GeneRule retVal;
        switch (kids.size()) {
        case 0 :
            retVal = EMPTY;
            break;
        case 1 :
            retVal = kids.get(0);
            break;
        default :
            retVal = new GeneRule(type, null, Collections.unmodifiableList(kids));
        }
        return retVal;
    }

    /**
     * Parse a rule string.  The operators may be "and"/"or" in any case, or "&amp;", "&amp;&amp;",
     * "|", "||".  AND binds more tightly than OR.
     *
     * @param ruleString	rule string to parse (may be NULL or blank)
     *
     * @return the parsed rule
     *
     * @throws IllegalArgumentException if the rule is not well-formed
     */
    public static GeneRule parse(String ruleString) {
        GeneRule retVal = EMPTY;
        if (! StringUtils.isBlank(ruleString)) {
            Parser parser = new Parser(ruleString);
            retVal = parser.parse();
        }
        return retVal;
    }

    /**
     * This is a small recursive-descent parser for rule strings.
     */
    private static class Parser {

        /** list of tokens */
        private List<String> tokens;
        /** position of the next token */
        private int pos;
        /** original rule string, for error messages */
        private String source;

        /**
         * Tokenize a rule string.
         *
         * @param ruleString	rule string to parse
         */
        protected Parser(String ruleString) {
            this.source = ruleString;
            this.tokens = new ArrayList<String>();
            this.pos = 0;
            final int n = ruleString.length();
            int i = 0;
            while (i < n) {
                char c = ruleString.charAt(i);
                if (Character.isWhitespace(c))
                    i++;
                else if (c == '(' || c == ')') {
                    this.tokens.add(String.valueOf(c));
                    i++;
                } else if (c == '&' || c == '|') {
                    int end = i + 1;
                    if (end < n && ruleString.charAt(end) == c)
                        end++;
                    this.tokens.add(c == '&' ? "and" : "or");
                    i = end;
                } else {
                    int end = i + 1;
                    while (end < n && ! isDelimiter(ruleString.charAt(end)))
                        end++;
                    String word = ruleString.substring(i, end);
                    if (word.equalsIgnoreCase("and") || word.equalsIgnoreCase("or"))
                        word = word.toLowerCase();
                    this.tokens.add(word);
                    i = end;
                }
            }
        }

        /**
         * @return TRUE if the character ends a gene ID
         *
         * @param c		character to check
         */
        private static boolean isDelimiter(char c) {
            return Character.isWhitespace(c) || c == '(' || c == ')' || c == '&' || c == '|';
        }

        /**
         * @return the parsed rule
         */
        protected GeneRule parse() {
            GeneRule retVal = this.parseOr();
            if (this.pos < this.tokens.size())
                throw new IllegalArgumentException("Unexpected \"" + this.tokens.get(this.pos)
                        + "\" in gene rule \"" + this.source + "\".");
            return retVal;
        }

        private GeneRule parseOr() {
            List<GeneRule> parts = new ArrayList<GeneRule>();
            parts.add(this.parseAnd());
            while (this.peek("or")) {
                this.pos++;
                parts.add(this.parseAnd());
            }
            return GeneRule.or(parts);
        }

        private GeneRule parseAnd() {
            List<GeneRule> parts = new ArrayList<GeneRule>();
            parts.add(this.parseFactor());
            while (this.peek("and")) {
                this.pos++;
                parts.add(this.parseFactor());
            }
            return GeneRule.and(parts);
        }

        private GeneRule parseFactor() {
            if (this.pos >= this.tokens.size())
                throw new IllegalArgumentException("Gene rule \"" + this.source + "\" ends unexpectedly.");
            String token = this.tokens.get(this.pos);
            this.pos++;
            GeneRule retVal;
            if (token.equals("(")) {
                retVal = this.parseOr();
                if (! this.peek(")"))
                    throw new IllegalArgumentException("Unbalanced parentheses in gene rule \"" + this.source + "\".");
                this.pos++;
            } else if (token.equals(")") || token.equals("and") || token.equals("or"))
                throw new IllegalArgumentException("Unexpected \"" + token + "\" in gene rule \"" + this.source + "\".");
            else
                retVal = GeneRule.gene(token);
            return retVal;
        }

        /**
         * @return TRUE if the next token is the specified one
         *
         * @param token		token to check for
         */
        private boolean peek(String token) {
            return (this.pos < this.tokens.size() && this.tokens.get(this.pos).equals(token));
        }

    }

    /**
     * @return the type of this rule node
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return the gene ID of a GENE node, or NULL for any other node
     */
    public String getGene() {
        return this.gene;
    }

    /**
     * @return the sub-rules of an operator node (empty for other nodes)
     */
    public List<GeneRule> getChildren() {
        return this.children;
    }

    /**
     * @return TRUE if this rule is empty
     */
    public boolean isEmpty() {
        return this.type == Type.EMPTY;
    }

    /**
     * @return the set of gene IDs in this rule, in order of first appearance
     */
    public Set<String> getGenes() {
        Set<String> retVal = new LinkedHashSet<String>();
        this.collectGenes(retVal);
        return retVal;
    }

    /**
     * Add the genes in this rule to a set.
     *
     * @param genes		output set of gene IDs
     */
    private void collectGenes(Set<String> genes) {
        if (this.type == Type.GENE)
            genes.add(this.gene);
        else {
            for (GeneRule child : this.children)
                child.collectGenes(genes);
        }
    }

    /**
     * @return a copy of this rule with the gene IDs translated
     *
     * @param translator	function mapping old gene IDs to new ones
     */
    public GeneRule rename(Function<String, String> translator) {
        GeneRule retVal;
        switch (this.type) {
        case GENE :
            retVal = GeneRule.gene(translator.apply(this.gene));
            break;
        case AND :
        case OR :
            List<GeneRule> kids = this.children.stream().map(x -> x.rename(translator))
                    .collect(Collectors.toList());
            retVal = combine(this.type, kids);
            break;
        default :
            retVal = this;
        }
        return retVal;
    }

    @Override
    public String toString() {
        String retVal;
        switch (this.type) {
        case GENE :
            retVal = this.gene;
            break;
        case AND :
        case OR :
            retVal = this.children.stream().map(x -> x.nestedString())
                    .collect(Collectors.joining(this.type.getOperator()));
            break;
        default :
            retVal = "";
        }
        return retVal;
    }

    /**
     * @return the string for this rule when it is a sub-rule of an operator
     */
    private String nestedString() {
        String retVal = this.toString();
        if (this.type == Type.AND || this.type == Type.OR)
            retVal = "(" + retVal + ")";
        return retVal;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + this.type.hashCode();
        result = prime * result + ((this.gene == null) ? 0 : this.gene.hashCode());
        result = prime * result + this.children.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        GeneRule other = (GeneRule) obj;
        if (this.type != other.type)
            return false;
        if (this.gene == null) {
            if (other.gene != null)
                return false;
        } else if (! this.gene.equals(other.gene))
            return false;
        return this.children.equals(other.children);
    }

}
