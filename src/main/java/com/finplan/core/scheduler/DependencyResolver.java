package com.finplan.core.scheduler;

import com.finplan.core.model.Driver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders drivers so that every driver comes after the drivers it depends on.
 *
 * <p>Iterative depth-first search with three-colour marking. Roots are taken in input order
 * and dependencies in declared order, so identical input always yields the identical order.
 * Dependencies on ids that are not in the input are skipped here; evaluation reports them.
 */
@Service
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    private enum Mark { WHITE, GREY, BLACK }

    /** One stack frame: a driver and the index of the next dependency to visit. */
    private static final class Frame {
        final Driver driver;
        int next;

        Frame(Driver driver) {
            this.driver = driver;
        }
    }

    /**
     * @param drivers all drivers of a scenario
     * @return drivers in evaluation order, dependencies first
     * @throws CyclicDependencyException if any driver transitively depends on itself
     * @throws IllegalArgumentException  if two drivers share an id
     */
    public List<Driver> resolve(List<Driver> drivers) {
        var byId = new LinkedHashMap<String, Driver>();
        for (Driver driver : drivers) {
            if (byId.putIfAbsent(driver.id(), driver) != null) {
                throw new IllegalArgumentException("Duplicate driver id: " + driver.id());
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        byId.keySet().forEach(id -> marks.put(id, Mark.WHITE));
        var order = new ArrayList<Driver>(drivers.size());

        for (Driver root : byId.values()) {
            if (marks.get(root.id()) != Mark.WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root));
            marks.put(root.id(), Mark.GREY);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                List<String> deps = top.driver.dependencies();
                if (top.next < deps.size()) {
                    String depId = deps.get(top.next++);
                    Driver dep = byId.get(depId);
                    if (dep == null) {
                        log.debug("Driver {} depends on unknown driver {}; left for evaluation to report",
                                top.driver.id(), depId);
                        continue;
                    }
                    switch (marks.get(depId)) {
                        case GREY -> throw new CyclicDependencyException(cyclePath(stack, depId));
                        case WHITE -> {
                            marks.put(depId, Mark.GREY);
                            stack.push(new Frame(dep));
                        }
                        case BLACK -> { }
                    }
                } else {
                    stack.pop();
                    marks.put(top.driver.id(), Mark.BLACK);
                    order.add(top.driver);
                }
            }
        }

        log.debug("Resolved evaluation order for {} drivers", order.size());
        return order;
    }

    private static List<String> cyclePath(Deque<Frame> stack, String repeatedId) {
        var path = new ArrayList<String>();
        var it = stack.descendingIterator();
        boolean inCycle = false;
        while (it.hasNext()) {
            String id = it.next().driver.id();
            if (id.equals(repeatedId)) {
                inCycle = true;
            }
            if (inCycle) {
                path.add(id);
            }
        }
        path.add(repeatedId);
        return path;
    }
}
