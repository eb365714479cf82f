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
 * Created on Mar 11, 2026
 */

package com.pologic.logic.rule;

/**
 * What a {@link Rule} does for each solution of its conditions.
 * 
 * @version $Id$
 */
public abstract class Action {

    private Action() {

    }

    /**
     * Derive the triple obtained by substituting the solution into the
     * template.
     */
    public static final class Assert extends Action {

        private final TripleTemplate template;

        public Assert(final TripleTemplate template) {

            if (template == null)
                throw new IllegalArgumentException();

            this.template = template;

        }

        public TripleTemplate getTemplate() {

            return template;

        }

        public String toString() {

            return "assert" + template;

        }

    }

    /**
     * Report a violation. <code>?name</code> in the reason is replaced by
     * the binding of that variable.
     */
    public static final class Reject extends Action {

        private final String reason;

        public Reject(final String reason) {

            if (reason == null)
                throw new IllegalArgumentException();

            this.reason = reason;

        }

        public String getReason() {

            return reason;

        }

        public String toString() {

            return "reject(" + reason + ")";

        }

    }

    /**
     * Report a violation unless some triple matches the template after
     * substitution. Variables left unbound match anything.
     */
    public static final class Require extends Action {

        private final TripleTemplate template;

        public Require(final TripleTemplate template) {

            if (template == null)
                throw new IllegalArgumentException();

            this.template = template;

        }

        public TripleTemplate getTemplate() {

            return template;

        }

        public String toString() {

            return "require" + template;

        }

    }

}
