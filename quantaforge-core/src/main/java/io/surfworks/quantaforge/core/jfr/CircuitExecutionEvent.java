package io.surfworks.quantaforge.core.jfr;

import jdk.jfr.Category;
import jdk.jfr.DataAmount;
import jdk.jfr.Description;
import jdk.jfr.Event;
import jdk.jfr.Label;
import jdk.jfr.Name;

/**
 * JFR event recording a single circuit execution.
 *
 * <p>Usage:
 * <pre>{@code
 * CircuitExecutionEvent event = new CircuitExecutionEvent();
 * event.begin();
 * // ... evolve and sample ...
 * event.backend = "density_matrix";
 * event.numQubits = 3;
 * event.numGates = 12;
 * event.commit();
 * }</pre>
 */
@Name("io.surfworks.quantaforge.CircuitExecution")
@Label("Circuit Execution")
@Category({"QuantaForge", "Simulation"})
@Description("Records one circuit execution on a simulation backend")
public class CircuitExecutionEvent extends Event {

    @Label("Backend")
    @Description("Backend name (statevector, density_matrix, stabilizer, noisy)")
    public String backend;

    @Label("Qubits")
    @Description("Number of qubits in the circuit")
    public int numQubits;

    @Label("Gates")
    @Description("Number of gates applied")
    public int numGates;

    @Label("Depth")
    @Description("Circuit depth in layers")
    public int depth;

    @Label("Shots")
    @Description("Number of measurement shots")
    public int shots;

    @Label("Shot Mode")
    @Description("REUSE_COLLAPSED or INDEPENDENT")
    public String shotMode;

    @Label("Noise Applications")
    @Description("Number of noise channel applications")
    public int noiseApplications;

    @Label("State Size")
    @Description("Estimated bytes held by the state tensor")
    @DataAmount
    public long stateBytes;
}
