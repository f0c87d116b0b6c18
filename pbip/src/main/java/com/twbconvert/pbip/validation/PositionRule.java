package com.twbconvert.pbip.validation;

import com.twbconvert.pbip.artifact.EmittedArtifactSet;
import com.twbconvert.pbip.report.PageSpec;
import com.twbconvert.pbip.report.Position;
import com.twbconvert.pbip.report.VisualSpec;
import java.util.ArrayList;
import java.util.List;

/** Visual rectangles are finite and non-negative; pages have a positive size. */
final class PositionRule implements SchemaRule {

    @Override
    public String name() {
        return "positions";
    }

    @Override
    public List<SchemaViolation> check(EmittedArtifactSet artifacts) {
        List<SchemaViolation> violations = new ArrayList<>();
        for (PageSpec page : artifacts.getReport().getPages()) {
            if (page.getWidth() <= 0 || page.getHeight() <= 0) {
                violations.add(new SchemaViolation(
                        name(), page.getName(), "page size " + page.getWidth() + "x" + page.getHeight() + " is not positive"));
            }
            for (VisualSpec visual : page.getVisuals()) {
                Position p = visual.getPosition();
                if (!valid(p.getX()) || !valid(p.getY()) || !valid(p.getZ()) || !valid(p.getWidth()) || !valid(p.getHeight())
                        || p.getTabOrder() < 0) {
                    violations.add(new SchemaViolation(
                            name(), page.getName() + "/" + visual.getName(), "position " + p + " is not finite and non-negative"));
                }
            }
        }
        return violations;
    }

    private static boolean valid(double value) {
        return Double.isFinite(value) && value >= 0;
    }
}
