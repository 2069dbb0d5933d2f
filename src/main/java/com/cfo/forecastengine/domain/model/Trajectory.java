package com.cfo.forecastengine.domain.model;

public final class Trajectory {

    private final double[] revenue;
    private final double[] expenses;
    private final double[] cashBalance;

    public Trajectory(int months) {
        this.revenue = new double[months];
        this.expenses = new double[months];
        this.cashBalance = new double[months];
    }

    public void set(int month, MonthlyRecord record) {
        revenue[month] = record.revenue();
        expenses[month] = record.expenses();
        cashBalance[month] = record.cashBalance();
    }

    public MonthlyRecord get(int month) {
        return new MonthlyRecord(revenue[month], expenses[month], cashBalance[month]);
    }

    public int months() {
        return cashBalance.length;
    }

    public double revenue(int month) {
        return revenue[month];
    }

    public double expenses(int month) {
        return expenses[month];
    }

    public double cashBalance(int month) {
        return cashBalance[month];
    }

    public double terminalCash() {
        return cashBalance[cashBalance.length - 1];
    }

    public boolean isFinite() {
        for (int m = 0; m < cashBalance.length; m++) {
            if (!Double.isFinite(revenue[m]) || !Double.isFinite(expenses[m])
                    || !Double.isFinite(cashBalance[m])) {
                return false;
            }
        }
        return true;
    }
}
