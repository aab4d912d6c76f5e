package model.schedule;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 车辆乘客计划：按 (出发时间, 时长) 排序的路段序列，每个路段附带乘客清单
 *
 * 不可变对象：addLegs / addPassenger 均返回新计划，原计划不受影响，
 * 因此可以在下发给车辆之前被多个组件安全地共享和推演。
 */
@EqualsAndHashCode
public final class PassengerSchedule {

    private static final PassengerSchedule EMPTY = new PassengerSchedule(new TreeMap<>());

    private final NavigableMap<Leg, Manifest> schedule;

    private PassengerSchedule(TreeMap<Leg, Manifest> schedule) {
        this.schedule = Collections.unmodifiableNavigableMap(schedule);
    }

    public static PassengerSchedule empty() {
        return EMPTY;
    }

    /**
     * 追加路段，清单为空
     * 调用方须保证传入路段已按时间排好序且互不重叠
     */
    public PassengerSchedule addLegs(List<Leg> legs) {
        TreeMap<Leg, Manifest> copy = new TreeMap<>(schedule);
        for (Leg leg : legs) {
            copy.put(leg, Manifest.empty());
        }
        return new PassengerSchedule(copy);
    }

    /**
     * 将乘客绑定到已存在的路段上：每段加入 riders，首段加入 boarders，末段加入 alighters
     *
     * @throws NoSuchElementException 路段尚未加入本计划
     */
    public PassengerSchedule addPassenger(PassengerRef passenger, List<Leg> legs) {
        TreeMap<Leg, Manifest> copy = new TreeMap<>(schedule);
        for (Leg leg : legs) {
            copy.put(leg, lookup(copy, leg).withRider(passenger));
        }
        if (!legs.isEmpty()) {
            Leg boardLeg = legs.get(0);
            Leg alightLeg = legs.get(legs.size() - 1);
            copy.put(boardLeg, copy.get(boardLeg).withBoarder(passenger.getVehicleId()));
            copy.put(alightLeg, copy.get(alightLeg).withAlighter(passenger.getVehicleId()));
        }
        return new PassengerSchedule(copy);
    }

    private static Manifest lookup(NavigableMap<Leg, Manifest> map, Leg leg) {
        Manifest manifest = map.get(leg);
        if (manifest == null) {
            throw new NoSuchElementException("路段不在乘客计划中: " + leg);
        }
        return manifest;
    }

    public List<Leg> getLegs() {
        return new ArrayList<>(schedule.keySet());
    }

    public Manifest getManifest(Leg leg) {
        return lookup(schedule, leg);
    }

    public Leg firstLeg() {
        return schedule.isEmpty() ? null : schedule.firstKey();
    }

    public Leg lastLeg() {
        return schedule.isEmpty() ? null : schedule.lastKey();
    }

    public boolean isEmpty() {
        return schedule.isEmpty();
    }

    public int size() {
        return schedule.size();
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        schedule.forEach((leg, manifest) -> parts.add(leg + " -> " + manifest));
        return String.join("--", parts);
    }
}
