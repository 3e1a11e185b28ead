package com.tracecontract.core;

/**
 * One entry of a compiled contract's dispatch table: the declaration together with its
 * validated template and parameter classification.
 */
public final class CompiledOperation {

    private final String contractName;
    private final OperationSpec spec;
    private final ValidatedTemplate template;
    private final Classification classification;

    CompiledOperation(String contractName, OperationSpec spec, ValidatedTemplate template,
                      Classification classification) {
        this.contractName = contractName;
        this.spec = spec;
        this.template = template;
        this.classification = classification;
    }

    public String name() {
        return spec.name();
    }

    public LogLevel level() {
        return spec.level();
    }

    public boolean returnsActivity() {
        return spec.returnsActivity();
    }

    public OperationSpec spec() {
        return spec;
    }

    public ValidatedTemplate template() {
        return template;
    }

    public Classification classification() {
        return classification;
    }

    /**
     * Formats one invocation with the given arguments.
     *
     * @throws FormatException if the arguments cannot be rendered
     */
    public FormattedRecord format(Object... values) {
        return RecordFormatter.format(contractName, spec, template, classification, values);
    }

    @Override
    public String toString() {
        return "CompiledOperation[" + contractName + "." + spec.name() + " " + spec.level()
                + " \"" + template.positional() + "\"]";
    }
}
