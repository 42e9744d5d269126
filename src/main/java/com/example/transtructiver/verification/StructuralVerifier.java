package com.example.transtructiver.verification;

import com.example.transtructiver.Node;
import com.example.transtructiver.NodePath;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks that a mutated tree has the same shape as its original and differs in text only
 * where the manifest allows it.
 * <p>
 * Both trees are walked together from the root. Errors are collected in the order they are
 * met rather than failing fast. When child counts differ at a node the walk does not enter
 * that node's children, but it goes on with its siblings. The verifier keeps no state, so
 * one instance can serve any number of threads.
 */
@Component
public class StructuralVerifier {

    public VerificationResult verify(Node original, Node mutated, Manifest manifest) {
        List<VerificationError> errors = new ArrayList<>();
        compare(original, mutated, NodePath.ROOT, manifest == null ? Manifest.EMPTY : manifest, errors);
        return VerificationResult.of(errors);
    }

    private void compare(Node original, Node mutated, String path, Manifest manifest, List<VerificationError> errors) {
        if (manifest.isIgnored(path)) {
            return;
        }

        if (!original.getType().equals(mutated.getType())) {
            errors.add(VerificationError.typeMismatch(path, original.getType(), mutated.getType()));
        } else {
            checkText(original, mutated, path, manifest, errors);
        }

        List<Node> originalChildren = original.getChildren();
        List<Node> mutatedChildren = mutated.getChildren();
        if (originalChildren.size() != mutatedChildren.size()) {
            errors.add(VerificationError.structuralMismatch(path));
            return;
        }

        for (int i = 0; i < originalChildren.size(); i++) {
            compare(originalChildren.get(i), mutatedChildren.get(i), NodePath.child(path, i), manifest, errors);
        }
    }

    private void checkText(Node original, Node mutated, String path, Manifest manifest, List<VerificationError> errors) {
        if (manifest.isRenamed(path)) {
            String expected = manifest.renamedPaths().get(path);
            if (expected == null || !expected.equals(mutated.getText())) {
                errors.add(VerificationError.mutationFail(path, expected, mutated.getText()));
            }
        } else if (!Objects.equals(original.getText(), mutated.getText())) {
            errors.add(VerificationError.unexpectedChange(path, original.getText(), mutated.getText()));
        }
    }
}
