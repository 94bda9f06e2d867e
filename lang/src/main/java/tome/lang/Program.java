package tome.lang;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import lombok.NonNull;

public record Program(@NonNull ImmutableList<DialogueNode> nodes) {

    /** Projects the choice and goto statements into a graph of node ids. */
    public NodeNetwork network() {
        var ids = ImmutableSet.<String>builder();
        var links = ImmutableList.<NodeNetwork.Link>builder();
        for (var node : nodes) {
            ids.add(node.id());
            for (var statement : node.statements()) {
                if (statement instanceof Statement.Choice choice) {
                    links.add(new NodeNetwork.Link(node.id(), choice.target()));
                } else if (statement instanceof Statement.Goto jump) {
                    links.add(new NodeNetwork.Link(node.id(), jump.target()));
                }
            }
        }
        return new NodeNetwork(ids.build(), links.build());
    }
}
