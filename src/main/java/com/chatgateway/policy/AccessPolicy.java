package com.chatgateway.policy;

import com.chatgateway.ErrorKind;
import com.chatgateway.models.AccessLevel;
import com.chatgateway.models.ModelDescriptor;
import com.chatgateway.models.UserProfile;

/**
 * Decides whether a user may run a turn on a model. Pure: reads its arguments only.
 */
public class AccessPolicy {

    public Authorization authorize(UserProfile profile, ModelDescriptor model) {
        return authorize(profile, model, model != null ? model.getName() : null);
    }

    public Authorization authorize(UserProfile profile, ModelDescriptor model, String requestedName) {
        if (model == null) {
            return Authorization.deny(ErrorKind.MODEL_UNKNOWN,
                "Model '" + requestedName + "' is not available");
        }
        AccessLevel level = profile.getAccessLevel() != null ? profile.getAccessLevel() : AccessLevel.BASIC;
        if (!level.isAtLeast(model.getMinAccessLevel())) {
            return Authorization.deny(ErrorKind.INSUFFICIENT_ACCESS_LEVEL,
                "Model '" + model.getName() + "' requires access level "
                    + model.getMinAccessLevel().displayName() + " (you have " + level.displayName() + ")");
        }
        int cost = Math.max(0, model.getCreditCost());
        if (profile.getCredit() < cost) {
            return Authorization.deny(ErrorKind.INSUFFICIENT_CREDIT,
                "Insufficient credit: model '" + model.getName() + "' costs " + cost
                    + ", balance is " + profile.getCredit());
        }
        return Authorization.allow(cost);
    }
}
