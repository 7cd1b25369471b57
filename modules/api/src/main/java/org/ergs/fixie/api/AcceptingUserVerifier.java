package org.ergs.fixie.api;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Accepts every well-formed user/token pair. Deployments with a credentials
 * service replace it by providing their own {@link UserVerifier} bean.
 */
@DefaultBean
@ApplicationScoped
public class AcceptingUserVerifier implements UserVerifier {

    @Override
    public boolean verify(String user, String token) {
        return true;
    }
}
