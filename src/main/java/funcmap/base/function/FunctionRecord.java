package funcmap.base.function;

import funcmap.base.Address;
import funcmap.base.graph.TransitionGraph;
import funcmap.base.graph.TransitionGraphView;
import funcmap.utils.Logging;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A recovered function and what is known about it so far.
 * The record only accumulates: every mutator is idempotent under repeated
 * identical input, and nothing is validated.
 */
public class FunctionRecord {

    private final Address addr;
    private String name;

    private final TransitionGraph transitionGraph = new TransitionGraph();
    private final Set<Address> retSites = new LinkedHashSet<>();
    private final Map<Address, CallSite> callSites = new LinkedHashMap<>();
    private final Map<Address, Address> retnAddrToCallSite = new LinkedHashMap<>();

    /** Register offsets of those arguments passed in registers */
    private final List<Integer> argumentRegisters = new ArrayList<>();
    /** Stack offsets of those arguments passed in stack variables */
    private final List<Long> argumentStackVariables = new ArrayList<>();

    /** Following frame information is set by the variable recovery pass */
    private boolean bpOnStack = false;
    private boolean retaddrOnStack = false;
    private long spDifference = 0;

    public FunctionRecord(Address addr) {
        this(addr, null);
    }

    /**
     * @param addr the entry address of the function
     * @param name the display name, may be null
     */
    public FunctionRecord(Address addr, String name) {
        this.addr = Objects.requireNonNull(addr, "entry address");
        this.name = name;
    }

    public Address getAddress() {
        return addr;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Registers a basic block as part of this function.
     * @param blockAddr the address of the basic block
     */
    public void addBlock(Address blockAddr) {
        transitionGraph.addBlock(blockAddr);
    }

    /**
     * Registers an edge between basic blocks in this function's transition graph.
     * @param fromAddr the block that control flow leaves during this transition
     * @param toAddr the block that control flow enters during this transition
     */
    public void transitTo(Address fromAddr, Address toAddr) {
        transitionGraph.addEdge(fromAddr, toAddr, TransitionGraph.EdgeType.TRANSITION);
    }

    /**
     * Registers control resuming in this function after a callee returns.
     * @param firstBlockAddr the block control flow leaves
     * @param toAddr the block where execution resumes
     */
    public void returnFromCall(Address firstBlockAddr, Address toAddr) {
        transitionGraph.addEdge(firstBlockAddr, toAddr, TransitionGraph.EdgeType.RETURN_FROM_CALL);
    }

    /**
     * Registers a basic block ending with a return.
     * @param retSiteAddr the address of the block
     */
    public void addReturnSite(Address retSiteAddr) {
        retSites.add(Objects.requireNonNull(retSiteAddr, "return site"));
    }

    /**
     * Registers a basic block as calling a function and returning somewhere.
     * A later registration for the same call site replaces the earlier one.
     * @param callSiteAddr the basic block that ends in a call
     * @param targetAddr the target of said call
     * @param retnAddr the address that said call is expected to return to
     */
    public void addCallSite(Address callSiteAddr, Address targetAddr, Address retnAddr) {
        CallSite callSite = new CallSite(callSiteAddr, targetAddr, retnAddr);
        CallSite old = callSites.put(callSiteAddr, callSite);
        if (old != null && !old.equals(callSite)) {
            Logging.debug("FunctionRecord", String.format("%s overwrites %s in %s", callSite, old, this.toShortString()));
            // The reverse entry must not outlive the forward one it mirrored
            if (!old.returnAddr.equals(retnAddr) && callSiteAddr.equals(retnAddrToCallSite.get(old.returnAddr))) {
                retnAddrToCallSite.remove(old.returnAddr);
            }
        }
        retnAddrToCallSite.put(retnAddr, callSiteAddr);
    }

    /**
     * Gets all the basic blocks that end in calls.
     */
    public Set<Address> getCallSiteAddrs() {
        return Collections.unmodifiableSet(callSites.keySet());
    }

    public Collection<CallSite> getCallSites() {
        return Collections.unmodifiableCollection(callSites.values());
    }

    public Optional<CallSite> getCallSite(Address callSiteAddr) {
        return Optional.ofNullable(callSites.get(callSiteAddr));
    }

    /**
     * Get the target of a call.
     * @param callSiteAddr the address of the basic block that ends in a call
     * @return the target of said call, empty if the call site is unknown
     */
    public Optional<Address> getCallTarget(Address callSiteAddr) {
        return getCallSite(callSiteAddr).map(cs -> cs.targetAddr);
    }

    /**
     * Get the hypothetical return address of a call.
     * @param callSiteAddr the address of the basic block that ends in a call
     * @return the likely return target of said call, empty if the call site is unknown
     */
    public Optional<Address> getCallReturn(Address callSiteAddr) {
        return getCallSite(callSiteAddr).map(cs -> cs.returnAddr);
    }

    /**
     * Find the call site whose hypothetical return address is {@code retnAddr}.
     */
    public Optional<Address> getCallSiteByReturn(Address retnAddr) {
        return Optional.ofNullable(retnAddrToCallSite.get(retnAddr));
    }

    public Map<Address, Address> getReturnToCallSite() {
        return Collections.unmodifiableMap(retnAddrToCallSite);
    }

    public void addArgumentRegister(int regOffset) {
        if (!argumentRegisters.contains(regOffset)) {
            argumentRegisters.add(regOffset);
        }
    }

    public void addArgumentStackVariable(long stackVarOffset) {
        if (!argumentStackVariables.contains(stackVarOffset)) {
            argumentStackVariables.add(stackVarOffset);
        }
    }

    public List<Integer> getArgumentRegisters() {
        return Collections.unmodifiableList(argumentRegisters);
    }

    public List<Long> getArgumentStackVariables() {
        return Collections.unmodifiableList(argumentStackVariables);
    }

    public Arguments getArguments() {
        return new Arguments(argumentRegisters, argumentStackVariables);
    }

    public Address getStartpoint() {
        return addr;
    }

    /**
     * The basic blocks ending in a return.
     */
    public List<Address> getEndpoints() {
        return new ArrayList<>(retSites);
    }

    public Set<Address> getReturnSites() {
        return Collections.unmodifiableSet(retSites);
    }

    /**
     * All basic blocks of this function: registered blocks and every
     * endpoint of a transition edge.
     */
    public Set<Address> getBasicBlocks() {
        return transitionGraph.getNodes();
    }

    public TransitionGraphView getTransitionGraph() {
        return transitionGraph;
    }

    public boolean hasReturn() {
        return !retSites.isEmpty();
    }

    public boolean isBpOnStack() {
        return bpOnStack;
    }

    public void setBpOnStack(boolean bpOnStack) {
        this.bpOnStack = bpOnStack;
    }

    public boolean isRetaddrOnStack() {
        return retaddrOnStack;
    }

    public void setRetaddrOnStack(boolean retaddrOnStack) {
        this.retaddrOnStack = retaddrOnStack;
    }

    /**
     * Net stack pointer adjustment across the function body.
     */
    public long getSpDifference() {
        return spDifference;
    }

    public void setSpDifference(long spDifference) {
        this.spDifference = spDifference;
    }

    /**
     * Returns a representation of the list of basic blocks in this function.
     */
    public String dbgPrint() {
        return getBasicBlocks().stream()
                .map(Address::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }

    public String toShortString() {
        if (name == null) {
            return String.format("<Function %s>", addr);
        }
        return String.format("<Function %s (%s)>", name, addr);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (name == null) {
            builder.append("Function [").append(addr).append("]\n");
        } else {
            builder.append("Function ").append(name).append(" [").append(addr).append("]\n");
        }
        builder.append("SP difference: ").append(spDifference).append('\n');
        builder.append("Has return: ").append(hasReturn()).append('\n');
        builder.append("Arguments: reg: ").append(argumentRegisters)
                .append(", stack: ").append(argumentStackVariables).append('\n');
        builder.append("Blocks: ").append(dbgPrint());
        return builder.toString();
    }

    /**
     * Argument locations recovered for a function, in discovery order.
     */
    public static class Arguments {
        public final List<Integer> registers;
        public final List<Long> stackVariables;

        public Arguments(List<Integer> registers, List<Long> stackVariables) {
            this.registers = List.copyOf(registers);
            this.stackVariables = List.copyOf(stackVariables);
        }

        @Override
        public String toString() {
            return String.format("Arguments{reg=%s, stack=%s}", registers, stackVariables);
        }
    }
}
