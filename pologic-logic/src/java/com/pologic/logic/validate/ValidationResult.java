/*

Copyright (C) SYSTAP, LLC 2006-2008.  All rights reserved.

Contact:
     SYSTAP, LLC
     4501 Tower Road
     Greensboro, NC 27410
     licenses@bigdata.com

This program is free software; you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation; version 2 of the License.

This program is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with this program; if not, write to the Free Software
Foundation, Inc., 59 Temple Place, Suite 330, Boston, MA  02111-1307  USA

*/
/*
 * Created on Mar 14, 2026
 */

package com.pologic.logic.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pologic.logic.LogicException;
import com.pologic.logic.rule.Severity;

/**
 * The outcome of a validation. The result is valid iff no error has a
 * {@link Severity#isBlocking() blocking} severity.
 * 
 * @version $Id$
 */
public class ValidationResult {

    private final List<ValidationError> errors;

    private final boolean valid;

    public ValidationResult(final List<ValidationError> errors) {

        if (errors == null)
            throw new IllegalArgumentException();

        this.errors = Collections
                .unmodifiableList(new ArrayList<ValidationError>(errors));

        boolean ok = true;

        for (ValidationError e : errors) {

            if (e.getSeverity().isBlocking()) {

                ok = false;

                break;

            }

        }

        this.valid = ok;

    }

    public boolean isValid() {

        return valid;

    }

    public List<ValidationError> getErrors() {

        return errors;

    }

    /**
     * The errors at the given severity.
     */
    public List<ValidationError> getErrors(final Severity severity) {

        final List<ValidationError> a = new ArrayList<ValidationError>();

        for (ValidationError e : errors) {

            if (e.getSeverity() == severity)
                a.add(e);

        }

        return a;

    }

    /**
     * @throws LogicException
     *             of kind {@link LogicException.Kind#VALIDATION_FAILED} (or
     *             {@link LogicException.Kind#CONTRADICTION} if any blocking
     *             error is a contradiction) unless the result is valid.
     */
    public void assertValid() {

        if (valid)
            return;

        LogicException.Kind kind = LogicException.Kind.VALIDATION_FAILED;

        for (ValidationError e : errors) {

            if (e.getSeverity().isBlocking()
                    && e.getKind() == ValidationError.Kind.CONTRADICTION)
                kind = LogicException.Kind.CONTRADICTION;

        }

        throw new LogicException(kind, errors.toString());

    }

    public String toString() {

        return "ValidationResult{valid=" + valid + ",errors=" + errors + "}";

    }

}
