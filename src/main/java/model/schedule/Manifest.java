package model.schedule;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 单个路段的乘客清单：在车乘客、本段上车、本段下车
 * 不可变，每次变更返回新对象
 */
@Getter
@EqualsAndHashCode
public final class Manifest {

    private static final Manifest EMPTY = new Manifest(Set.of(), Set.of(), Set.of());

    private final Set<PassengerRef> riders;
    private final Set<String> boarders;   // 上车乘客的载体车辆ID
    private final Set<String> alighters;  // 下车乘客的载体车辆ID

    private Manifest(Set<PassengerRef> riders, Set<String> boarders, Set<String> alighters) {
        this.riders = riders;
        this.boarders = boarders;
        this.alighters = alighters;
    }

    public static Manifest empty() {
        return EMPTY;
    }

    public Manifest withRider(PassengerRef passenger) {
        return new Manifest(plus(riders, passenger), boarders, alighters);
    }

    public Manifest withBoarder(String passengerVehicleId) {
        return new Manifest(riders, plus(boarders, passengerVehicleId), alighters);
    }

    public Manifest withAlighter(String passengerVehicleId) {
        return new Manifest(riders, boarders, plus(alighters, passengerVehicleId));
    }

    private static <T> Set<T> plus(Set<T> source, T element) {
        Set<T> copy = new LinkedHashSet<>(source);
        copy.add(element);
        return Collections.unmodifiableSet(copy);
    }

    @Override
    public String toString() {
        return String.format("[%d riders;%d boarders;%d alighters]", riders.size(), boarders.size(), alighters.size());
    }
}
