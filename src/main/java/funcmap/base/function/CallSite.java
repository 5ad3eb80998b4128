package funcmap.base.function;

import funcmap.base.Address;

import java.util.Objects;

/**
 * A basic block ending in a call, with the call target and the address the
 * recovery driver expects control to come back to. The return address is
 * inferred from the calling convention, it is not ground truth.
 */
public class CallSite {
    public final Address callSiteAddr;
    public final Address targetAddr;
    public final Address returnAddr;

    public CallSite(Address callSiteAddr, Address targetAddr, Address returnAddr) {
        this.callSiteAddr = Objects.requireNonNull(callSiteAddr, "call site");
        this.targetAddr = Objects.requireNonNull(targetAddr, "call target");
        this.returnAddr = Objects.requireNonNull(returnAddr, "return address");
    }

    @Override
    public String toString() {
        return String.format("CallSite{BBAddr=%s, target=%s, retn=%s}", callSiteAddr, targetAddr, returnAddr);
    }

    @Override
    public int hashCode() {
        return callSiteAddr.hashCode() * 31 + targetAddr.hashCode() * 17 + returnAddr.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CallSite other)) {
            return false;
        }
        return this.callSiteAddr.equals(other.callSiteAddr) &&
                this.targetAddr.equals(other.targetAddr) &&
                this.returnAddr.equals(other.returnAddr);
    }
}
