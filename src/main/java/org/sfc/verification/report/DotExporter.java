package org.sfc.verification.report;

import org.sfc.verification.petrinet.models.InputArc;
import org.sfc.verification.petrinet.models.NetTransition;
import org.sfc.verification.petrinet.models.OutputArc;
import org.sfc.verification.petrinet.models.PetriNet;
import org.sfc.verification.petrinet.models.Place;
import org.sfc.verification.sfc.models.Sfc;
import org.sfc.verification.sfc.models.Step;
import org.sfc.verification.sfc.models.Transition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Graphviz DOT text for a model and for its token-flow graph.
 */
public class DotExporter {

    public static String sfcToDot(Sfc sfc) {
        StringBuilder dot = new StringBuilder("digraph SFC {\n");
        dot.append("  rankdir=TB;\n");
        for (Step step : sfc.steps()) {
            String shape = step.name().equals(sfc.initialStep()) ? "doubleoctagon" : "box";
            dot.append("  ").append(quote(step.name()))
                    .append(" [shape=").append(shape)
                    .append(", label=").append(quote(label(step.name(), step.function())))
                    .append("];\n");
        }
        List<Transition> transitions = sfc.transitions();
        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            String guard = transition.guard().text();
            for (String src : transition.src()) {
                for (String tgt : transition.tgt()) {
                    dot.append("  ").append(quote(src)).append(" -> ").append(quote(tgt))
                            .append(" [label=").append(quote(guard.isEmpty() ? NetTransition.idFor(i) : guard))
                            .append("];\n");
                }
            }
        }
        return dot.append("}\n").toString();
    }

    public static String petriNetToDot(PetriNet net) {
        StringBuilder dot = new StringBuilder("digraph PetriNet {\n");
        dot.append("  rankdir=LR;\n");
        for (Place place : net.places()) {
            String style = net.initialMarking().contains(place.name()) ? ", style=bold" : "";
            dot.append("  ").append(quote(place.name()))
                    .append(" [shape=circle").append(style)
                    .append(", label=").append(quote(label(place.name(), place.function())))
                    .append("];\n");
        }
        for (NetTransition transition : net.transitions()) {
            String guard = transition.guard().text();
            dot.append("  ").append(quote(transition.id()))
                    .append(" [shape=box, label=").append(quote(guard.isEmpty() ? transition.id() : transition.id() + "\n" + guard))
                    .append("];\n");
        }
        for (InputArc arc : net.inputArcs()) {
            dot.append("  ").append(quote(arc.place())).append(" -> ").append(quote(arc.transition())).append(";\n");
        }
        for (OutputArc arc : net.outputArcs()) {
            dot.append("  ").append(quote(arc.transition())).append(" -> ").append(quote(arc.place())).append(";\n");
        }
        return dot.append("}\n").toString();
    }

    public static void write(String dot, String outputFilePath) {
        try {
            Files.writeString(Path.of(outputFilePath), dot, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Error writing DOT file " + outputFilePath, e);
        }
    }

    private static String label(String name, String function) {
        return function == null || function.isBlank() ? name : name + "\n" + function;
    }

    private static String quote(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n") + "\"";
    }
}
